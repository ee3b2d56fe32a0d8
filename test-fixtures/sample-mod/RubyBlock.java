package com.example.rubymod;

import net.minecraft.world.World;
import net.minecraft.entity.player.PlayerEntity;
import net.minecraftforge.event.entity.player.PlayerEvent;
import net.fabricmc.api.ModInitializer;
import java.util.List;

/* Block that hums and counts how often it was used. */
public class RubyBlock {
    private int uses = 0;

    public void onUse(World world, PlayerEntity player) {
        if (player != null) {
            player.sendMessage("You used the ruby block");
        }
        uses = uses + 1;
    }

    public void tick(World world) {
        for (int i = 0; i < 3; i++) {
            world.playSound("ruby.hum");
        }
    }

    public int getUses() {
        return uses;
    }
}
