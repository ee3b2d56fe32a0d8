package com.modporter.logic;

import com.modporter.logic.mapping.ApiMapperService;
import com.modporter.logic.mapping.LegacyMappings;
import com.modporter.logic.mapping.MappingAdmin;
import com.modporter.logic.mapping.MappingAdmin.MappingStatistics;
import com.modporter.logic.mapping.MappingAdmin.ValidationReport;
import com.modporter.logic.mapping.MappingCache;
import com.modporter.logic.mapping.MappingModel.ApiMapping;
import com.modporter.logic.mapping.MappingModel.ConversionType;
import com.modporter.logic.mapping.MappingModel.ExampleUsage;
import com.modporter.logic.mapping.MappingModel.ImportResult;
import com.modporter.logic.mapping.MappingModel.MappingDraft;
import com.modporter.logic.mapping.MappingModel.MappingFilter;
import com.modporter.logic.mapping.MappingModel.MappingUpdate;
import com.modporter.logic.mapping.MappingStore;
import com.modporter.logic.mapping.MappingStore.MappingStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MappingAdminTest {

    private ApiMapperService mapper;
    private MappingAdmin admin;

    @BeforeEach
    void setUp() {
        mapper = new ApiMapperService(new MappingStore(), new MappingCache(10), LegacyMappings.empty(), 0.7);
        admin = new MappingAdmin(mapper);
    }

    @Test
    void validDraftHasNoErrors() {
        ValidationReport report = admin.validate(
                MappingDraft.of("net.minecraft.world.World.setBlockState(BlockPos)", "dimension.setBlock",
                        ConversionType.WRAPPER, "wrap position"));
        assertTrue(report.valid(), report.errors().toString());
        assertTrue(report.warnings().isEmpty());
    }

    @Test
    void blankAndMalformedFieldsAreErrors() {
        ValidationReport report = admin.validate(MappingDraft.of("not a signature!", "two\nlines", null, "x"));
        assertFalse(report.valid());
        assertEquals(3, report.errors().size(), report.errors().toString());
    }

    @Test
    void suspiciousDraftsProduceWarnings() {
        MappingDraft draft = new MappingDraft("a.b.C.m", "UNSUPPORTED", ConversionType.IMPOSSIBLE, "",
                new ExampleUsage("a()", "b()"), List.of(), List.of(), true);
        ValidationReport report = admin.validate(draft);
        assertTrue(report.valid());
        assertEquals(3, report.warnings().size());
    }

    @Test
    void signatureOwnedByAnotherMappingIsAnError() {
        ApiMapping existing = mapper.addMapping(MappingDraft.of("a.b.C.m", "x", ConversionType.DIRECT, "n"));
        MappingDraft same = MappingDraft.of("a.b.C.m", "y", ConversionType.DIRECT, "n");

        assertFalse(admin.validate(same).valid());
        assertTrue(admin.validate(same, existing.id()).valid());
    }

    @Test
    void statisticsGroupByTypeAndVersion() {
        ApiMapping first = mapper.addMapping(MappingDraft.of("a.A.one", "x", ConversionType.DIRECT, ""));
        mapper.addMapping(MappingDraft.of("a.A.two", "y", ConversionType.DIRECT, ""));
        mapper.addMapping(MappingDraft.of("a.A.three", "UNSUPPORTED", ConversionType.IMPOSSIBLE, ""));
        ApiMapping updated = mapper.updateMapping(first.id(), MappingUpdate.bedrockEquivalent("z"));

        MappingStatistics stats = admin.statistics();
        assertEquals(3, stats.totalMappings());
        assertEquals(2, stats.byConversionType().get(ConversionType.DIRECT));
        assertEquals(1, stats.byConversionType().get(ConversionType.IMPOSSIBLE));
        assertNull(stats.byConversionType().get(ConversionType.COMPLEX));
        assertEquals(2, stats.byVersion().get(1));
        assertEquals(1, stats.byVersion().get(2));
        assertEquals(updated.id(), stats.recentlyUpdated().get(0).id());
    }

    @Test
    void exportedDocumentImportsIntoAnotherStore() {
        mapper.addMapping(MappingDraft.of("a.A.one", "x", ConversionType.DIRECT, "first"));
        mapper.addMapping(MappingDraft.of("a.A.two", "y", ConversionType.COMPLEX, "second"));
        String exported = admin.exportJson(MappingFilter.ALL);
        assertTrue(exported.contains("\"mappings\""));
        assertTrue(exported.contains("\"direct\""));

        ApiMapperService target = new ApiMapperService(new MappingStore(), new MappingCache(10),
                LegacyMappings.empty(), 0.7);
        ImportResult result = new MappingAdmin(target).importJson(exported);

        assertEquals(2, result.added());
        assertEquals(0, result.failed());
        assertEquals("second", target.findMapping("a.A.two").orElseThrow().notes());
        assertEquals(1, target.findMapping("a.A.two").orElseThrow().version());
    }

    @Test
    void importReportsInvalidAndDuplicateEntries() {
        String json = "{\"mappings\": ["
                + "{\"javaSignature\": \"a.A.one\", \"bedrockEquivalent\": \"x\", \"conversionType\": \"direct\"},"
                + "{\"javaSignature\": \"a.A.one\", \"bedrockEquivalent\": \"y\", \"conversionType\": \"direct\"},"
                + "{\"javaSignature\": \"\", \"bedrockEquivalent\": \"y\", \"conversionType\": \"direct\"},"
                + "42"
                + "]}";
        ImportResult result = admin.importJson(json);

        assertEquals(1, result.added());
        assertEquals(3, result.failed());
        assertEquals(4, result.total());
        assertEquals("x", mapper.findMapping("a.A.one").orElseThrow().bedrockEquivalent());
    }

    @Test
    void malformedImportDocumentIsRejected() {
        assertThrows(MappingStoreException.class, () -> admin.importJson("{not json"));
        assertThrows(MappingStoreException.class, () -> admin.importJson("{\"entries\": []}"));
        assertThrows(MappingStoreException.class, () -> admin.importJson("[]"));
    }
}
