package com.modporter.logic.mapping;

import com.modporter.logic.mapping.MappingModel.ApiMapping;
import com.modporter.logic.mapping.MappingModel.ConversionType;
import com.modporter.logic.mapping.MappingModel.MappingDraft;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Field checks shared by the store (hard errors only) and the admin validation report.
 */
final class MappingValidator {

    private MappingValidator() {}

    /** Dotted Java member path with an optional parameter list, e.g. {@code World.setBlockState(BlockPos)}. */
    private static final Pattern JAVA_SIGNATURE = Pattern.compile(
            "[A-Za-z_$][\\w$]*(\\.[A-Za-z_$][\\w$<>\\[\\]]*)*(\\([^()]*\\))?");

    static List<String> coreErrors(String javaSignature, String bedrockEquivalent, ConversionType type) {
        List<String> errors = new ArrayList<>();
        if (javaSignature == null || javaSignature.isBlank()) {
            errors.add("javaSignature must not be blank");
        }
        if (bedrockEquivalent == null || bedrockEquivalent.isBlank()) {
            errors.add("bedrockEquivalent must not be blank");
        }
        if (type == null) {
            errors.add("conversionType is required");
        }
        return errors;
    }

    static List<String> storedRecordErrors(ApiMapping m) {
        if (m == null) return List.of("empty record");
        List<String> errors = coreErrors(m.javaSignature(), m.bedrockEquivalent(), m.conversionType());
        if (m.id() == null || m.id().isBlank()) errors.add("id must not be blank");
        if (m.version() < 1) errors.add("version must be at least 1");
        if (m.createdAt() == null || m.lastUpdated() == null) errors.add("timestamps are required");
        return errors;
    }

    /** Hard errors: core field checks plus signature and equivalent shape. */
    static List<String> draftErrors(MappingDraft draft) {
        List<String> errors = coreErrors(draft.javaSignature(), draft.bedrockEquivalent(), draft.conversionType());
        String sig = draft.javaSignature();
        if (sig != null && !sig.isBlank() && !JAVA_SIGNATURE.matcher(sig.trim()).matches()) {
            errors.add("javaSignature '" + sig + "' is not a dotted Java member path");
        }
        String equivalent = draft.bedrockEquivalent();
        if (equivalent != null && (equivalent.contains("\n") || equivalent.contains("\r"))) {
            errors.add("bedrockEquivalent must be a single line");
        }
        return errors;
    }

    static List<String> draftWarnings(MappingDraft draft) {
        List<String> warnings = new ArrayList<>();
        if (draft.notes() == null || draft.notes().isBlank()) {
            warnings.add("notes are empty; add a short explanation of the conversion");
        }
        if (draft.conversionType() == ConversionType.IMPOSSIBLE && draft.exampleUsage() != null) {
            warnings.add("impossible mappings should not carry an example usage");
        }
        if (draft.deprecated()) {
            warnings.add("mapping is marked deprecated");
        }
        return warnings;
    }
}
