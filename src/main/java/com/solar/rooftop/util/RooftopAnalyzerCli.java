package com.solar.rooftop.util;

import com.solar.rooftop.config.NativeLibraryLoader;
import com.solar.rooftop.config.SolarProperties;
import com.solar.rooftop.core.InvalidInputException;
import com.solar.rooftop.core.model.AnalysisResult;
import com.solar.rooftop.core.model.RooftopAnalysis;
import com.solar.rooftop.model.ConfigOverrides;
import com.solar.rooftop.service.AnalysisArtifacts;
import com.solar.rooftop.service.GeoJsonExporter;
import com.solar.rooftop.service.ReportWriter;
import com.solar.rooftop.service.RooftopAnalysisService;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * 命令行分析工具
 * <pre>
 * RooftopAnalyzerCli &lt;image&gt; [--output-dir DIR] [--lat L] [--lon L] [--pixel-to-meter S]
 * </pre>
 * 不启动 Web 服务，直接使用默认配置运行同一条流水线并写出相同的结果文件
 */
public class RooftopAnalyzerCli {

    static final String USAGE =
            "Usage: RooftopAnalyzerCli <image> [--output-dir DIR] [--lat L] [--lon L] [--pixel-to-meter S]";

    /**
     * 解析后的命令行参数
     */
    static class Arguments {
        Path image;
        Path outputDir = Paths.get("output");
        ConfigOverrides overrides = new ConfigOverrides();
    }

    static Arguments parse(String[] args) {
        Arguments parsed = new Arguments();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--output-dir" -> parsed.outputDir = Paths.get(value(args, ++i, arg));
                case "--lat" -> parsed.overrides.setLatitude(number(args, ++i, arg));
                case "--lon" -> parsed.overrides.setLongitude(number(args, ++i, arg));
                case "--pixel-to-meter" -> parsed.overrides.setPixelToMeter(number(args, ++i, arg));
                default -> {
                    if (arg.startsWith("--")) {
                        throw new InvalidInputException("Unknown option: " + arg);
                    }
                    if (parsed.image != null) {
                        throw new InvalidInputException("Only one image may be given");
                    }
                    parsed.image = Paths.get(arg);
                }
            }
        }
        if (parsed.image == null) {
            throw new InvalidInputException("Missing image path");
        }
        return parsed;
    }

    private static String value(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new InvalidInputException("Missing value for " + option);
        }
        return args[index];
    }

    private static double number(String[] args, int index, String option) {
        String raw = value(args, index, option);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Not a number for " + option + ": " + raw);
        }
    }

    public static void main(String[] args) {
        Arguments parsed;
        try {
            parsed = parse(args);
        } catch (InvalidInputException e) {
            System.err.println(e.getMessage());
            System.err.println(USAGE);
            System.exit(2);
            return;
        }

        NativeLibraryLoader.loadNativeLibraries();
        RooftopAnalysisService service =
                new RooftopAnalysisService(new SolarProperties(), new ReportWriter(), new GeoJsonExporter());

        System.out.println("╔═══════════════════════════════════════════════════════════╗");
        System.out.println("║              ROOFTOP SOLAR PANEL ANALYZER                 ║");
        System.out.println("╚═══════════════════════════════════════════════════════════╝");
        System.out.println("Image:    " + parsed.image);
        System.out.println("Output:   " + parsed.outputDir);

        try {
            AnalysisArtifacts artifacts = service.analyzeFile(parsed.image, parsed.overrides, parsed.outputDir);
            printSummary(artifacts);
        } catch (InvalidInputException e) {
            System.err.println("Invalid input: " + e.getMessage());
            System.exit(2);
        } catch (Exception e) {
            System.err.println("Analysis failed: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    private static void printSummary(AnalysisArtifacts artifacts) {
        AnalysisResult result = artifacts.getResult();
        System.out.println();
        if (result.isEmpty()) {
            System.out.println("No rooftops detected.");
        }
        for (RooftopAnalysis a : result.getAnalyses()) {
            System.out.printf("Rooftop #%d: %d panels, %.2f kW, %.0f kWh/yr, %s (%d/100)%n",
                    a.getRooftopId(), a.getPanelCount(),
                    a.getEnergy().getSystemCapacityKw(), a.getEnergy().getEstimatedAnnualKwh(),
                    a.getSuitability().getRating().getLabel(), a.getSuitability().getScore());
        }
        if (!result.getFailedRooftops().isEmpty()) {
            System.out.println("Skipped rooftops: " + result.getFailedRooftops());
        }
        System.out.println("───────────────────────────────────────────────────────────");
        System.out.printf("Total: %d panels, %.2f kW, %.0f kWh/yr, %.0f kg CO2/yr%n",
                result.getTotalPanels(), result.getTotalCapacityKw(),
                result.getTotalAnnualKwh(), result.getTotalCo2OffsetKg());
        System.out.println("Annotated image: " + artifacts.getAnnotatedImage());
        System.out.println("Report:          " + artifacts.getReport());
        System.out.println("GeoJSON:         " + artifacts.getGeoJson());
    }
}
