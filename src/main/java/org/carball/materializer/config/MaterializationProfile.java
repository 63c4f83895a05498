package org.carball.materializer.config;

import lombok.Getter;

@Getter
public enum MaterializationProfile {

    CONSERVATIVE("conservative", "Only materialize the hottest properties, small chunks",
            3, 500, 0.3, 1),

    BALANCED("balanced", "Default settings for most workloads",
            10, 100, 0.5, 1),

    AGGRESSIVE("aggressive", "Materialize more properties and backfill in larger chunks",
            25, 20, 0.7, 4) {
        @Override
        public MaterializerConfig buildConfig() {
            return super.buildConfig().toBuilder()
                    .backfillParallelism(4)
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final int topN;
    private final long minUsageThreshold;
    private final double savingsRatio;
    private final int chunkSize;

    MaterializationProfile(String name, String description,
                           int topN, long minUsageThreshold, double savingsRatio, int chunkSize) {
        this.name = name;
        this.description = description;
        this.topN = topN;
        this.minUsageThreshold = minUsageThreshold;
        this.savingsRatio = savingsRatio;
        this.chunkSize = chunkSize;
    }

    public MaterializerConfig buildConfig() {
        return MaterializerConfig.builder()
                .profileName(name)
                .profileDescription(description)
                .topN(topN)
                .minUsageThreshold(minUsageThreshold)
                .savingsRatio(savingsRatio)
                .chunkSize(chunkSize)
                .build();
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static MaterializationProfile fromName(String name) {
        for (MaterializationProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown materialization profile: " + name +
                ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (MaterializationProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }

    public static String getProfileHelp() {
        StringBuilder help = new StringBuilder();
        help.append("Available Materialization Profiles:\n\n");
        for (MaterializationProfile profile : values()) {
            help.append(String.format("  %-14s %s\n", profile.getName(), profile.getDescription()));
        }
        help.append("\nUse --profile <name> to select a profile.\n");
        return help.toString();
    }
}
