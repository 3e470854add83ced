package com.watchwise.backend.restriction.support;

import org.springframework.stereotype.Component;

import java.util.Map;

/** Display names for well-known bundle ids. */
@Component
public class AppCatalog {

    private static final Map<String, String> KNOWN = Map.ofEntries(
            Map.entry("com.burbn.instagram", "Instagram"),
            Map.entry("com.zhiliaoapp.musically", "TikTok"),
            Map.entry("com.google.ios.youtube", "YouTube"),
            Map.entry("com.apple.mobilesafari", "Safari"),
            Map.entry("com.apple.MobileSMS", "Messages"),
            Map.entry("com.toyopagroup.picaboo", "Snapchat"),
            Map.entry("com.whatsapp.WhatsApp", "WhatsApp"),
            Map.entry("com.facebook.Facebook", "Facebook"),
            Map.entry("com.twitter.ios", "Twitter"),
            Map.entry("com.hammerandchisel.discord", "Discord"),
            Map.entry("com.reddit.Reddit", "Reddit"),
            Map.entry("com.netflix.Netflix", "Netflix"),
            Map.entry("com.spotify.client", "Spotify"),
            Map.entry("com.mojang.minecraftpe", "Minecraft"),
            Map.entry("com.roblox.client", "Roblox"),
            Map.entry("com.epicgames.fortnite", "Fortnite"),
            Map.entry("com.activision.callofduty.shooter", "Call of Duty"),
            Map.entry("com.tencent.ig", "PUBG"),
            Map.entry("com.mihoyo.genshinimpact", "Genshin Impact"),
            Map.entry("com.innersloth.spacemafia", "Among Us")
    );

    /** Falls back to the last dotted segment, e.g. "com.acme.Notes" -> "Notes". */
    public String displayName(String bundleId) {
        if (bundleId == null || bundleId.isBlank()) return "Unknown App";
        String known = KNOWN.get(bundleId);
        if (known != null) return known;
        String trimmed = bundleId.trim();
        int dot = trimmed.lastIndexOf('.');
        String tail = dot >= 0 ? trimmed.substring(dot + 1) : trimmed;
        return tail.isEmpty() ? trimmed : tail;
    }

    public boolean isKnown(String bundleId) {
        return bundleId != null && KNOWN.containsKey(bundleId);
    }
}
