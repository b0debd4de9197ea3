package com.floodsampler.service;

import com.floodsampler.core.model.RegionFilter;
import com.floodsampler.core.model.TimeWindow;

import java.nio.file.Path;

public record CommandLineOptions(
        String county,
        String state,
        int months,
        int years,
        Path configFile,
        Path outputFile,
        Path cacheDir,
        Double ratio,
        Long seed,
        boolean help
) {
    public static final int DEFAULT_MONTHS = 12;
    public static final int DEFAULT_YEARS = 3;
    public static final Path DEFAULT_CONFIG = Path.of("config/flood-dataset.json");

    public static CommandLineOptions parse(String[] args) {
        String county = null;
        String state = null;
        int months = DEFAULT_MONTHS;
        int years = DEFAULT_YEARS;
        Path configFile = DEFAULT_CONFIG;
        Path outputFile = null;
        Path cacheDir = null;
        Double ratio = null;
        Long seed = null;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            switch (flag) {
                case "--help", "-h" -> help = true;
                case "--county" -> county = value(args, ++i, flag);
                case "--state" -> state = value(args, ++i, flag);
                case "--months" -> months = parseInt(value(args, ++i, flag), flag);
                case "--years" -> years = parseInt(value(args, ++i, flag), flag);
                case "--config" -> configFile = Path.of(value(args, ++i, flag));
                case "--output" -> outputFile = Path.of(value(args, ++i, flag));
                case "--cache-dir" -> cacheDir = Path.of(value(args, ++i, flag));
                case "--ratio" -> ratio = parseDouble(value(args, ++i, flag), flag);
                case "--seed" -> seed = parseLong(value(args, ++i, flag), flag);
                default -> throw new IllegalArgumentException("Unknown argument: " + flag);
            }
        }

        CommandLineOptions options = new CommandLineOptions(
                county, state, months, years, configFile, outputFile, cacheDir, ratio, seed, help);
        if (!help) {
            options.validate();
        }
        return options;
    }

    public RegionFilter regionFilter() {
        return new RegionFilter(county, state);
    }

    public static String usage() {
        return String.join("\n",
                "Usage: flood-dataset [--county NAME --state NAME] [--months 1-12] [--years 1-"
                        + TimeWindow.MAX_YEARS + "]",
                "                     [--config PATH] [--output PATH] [--cache-dir PATH] [--ratio X] [--seed N]",
                "",
                "  --county NAME     county to sample (requires --state)",
                "  --state NAME      state name or postal code; omit both for nationwide",
                "  --months N        months of each year to include, from January (default " + DEFAULT_MONTHS + ")",
                "  --years N         number of past years plus the current one (default " + DEFAULT_YEARS + ")",
                "  --config PATH     JSON config file (default " + DEFAULT_CONFIG + ")",
                "  --output PATH     CSV output file",
                "  --cache-dir PATH  raw response cache directory",
                "  --ratio X         negatives per positive",
                "  --seed N          seed basis for negative synthesis",
                "",
                "Example: flood-dataset --county Travis --state Texas --months 6 --years 2"
        );
    }

    private void validate() {
        if (county != null && state == null) {
            throw new IllegalArgumentException(
                    "--county requires --state, for example: --county Travis --state Texas");
        }
        if (months < 1 || months > 12) {
            throw new IllegalArgumentException("--months must be between 1 and 12, got: " + months);
        }
        if (years < 1 || years > TimeWindow.MAX_YEARS) {
            throw new IllegalArgumentException(
                    "--years must be between 1 and " + TimeWindow.MAX_YEARS + ", got: " + years);
        }
        if (ratio != null && (ratio.isNaN() || ratio < 0.0)) {
            throw new IllegalArgumentException("--ratio must be >= 0, got: " + ratio);
        }
    }

    private static String value(String[] args, int index, String flag) {
        if (index >= args.length || args[index].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + flag);
        }
        return args[index];
    }

    private static int parseInt(String raw, String flag) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + flag + ": " + raw, e);
        }
    }

    private static long parseLong(String raw, String flag) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + flag + ": " + raw, e);
        }
    }

    private static double parseDouble(String raw, String flag) {
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + flag + ": " + raw, e);
        }
    }
}
