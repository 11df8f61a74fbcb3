package com.finforecast.app;

import com.finforecast.config.Config;
import com.finforecast.core.diagnostics.Outcome;
import com.finforecast.data.FactDocumentLoader;
import com.finforecast.data.sec.SecClientSettings;
import com.finforecast.data.sec.SecCompanyFactsClient;
import com.finforecast.facts.FactNode;
import com.finforecast.metrics.Metric;
import com.finforecast.metrics.MetricRecord;
import com.finforecast.model.ForecastRun;
import com.finforecast.model.ForecastService;
import com.finforecast.model.ForecastSettings;
import com.finforecast.output.ProjectionExporter;
import com.finforecast.projection.ProjectionParams;
import com.finforecast.projection.Scenario;
import com.finforecast.valuation.ValuationSummary;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.io.IoBuilder;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public class FinForecastApplication {
    private static volatile boolean LOG_ROUTE_INSTALLED = false;

    private final Path workingDir;
    private final boolean routeLogs;

    public FinForecastApplication(Path workingDir, boolean routeLogs) {
        this.workingDir = workingDir;
        this.routeLogs = routeLogs;
    }

    public static void main(String[] args) {
        Path workingDir = Path.of(".").toAbsolutePath().normalize();
        int exit = new FinForecastApplication(workingDir, true).run(args);
        System.exit(exit);
    }

    public int run(String[] args) {
        Options options = buildOptions();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            new HelpFormatter().printHelp("finforecast", options);
            System.err.println("ERROR: " + e.getMessage());
            return 2;
        }

        if (cmd.hasOption("help")) {
            new HelpFormatter().printHelp("finforecast", options);
            return 0;
        }

        Config config = Config.load(workingDir);
        Path inputDir = optionPath(cmd, "input-dir", config.getPath("input.dir"));
        Path outputsDir = optionPath(cmd, "out-dir", config.getPath("outputs.dir"));
        if (routeLogs) {
            installLogRoutingIfNeeded(outputsDir);
        }
        FactDocumentLoader loader = new FactDocumentLoader(inputDir);

        try {
            if (cmd.hasOption("list-available")) {
                return listAvailable(loader);
            }
            String ticker = cmd.getOptionValue("ticker", "").trim().toUpperCase(Locale.ROOT);
            if (ticker.isEmpty()) {
                System.err.println("ERROR: --ticker is required.");
                return 2;
            }
            int yearsBack = intOption(cmd, "years-back", config.getInt("history.years_back", 5));
            if (yearsBack < 1) {
                System.err.println("ERROR: --years-back must be >= 1.");
                return 2;
            }
            Integer currentYear = cmd.hasOption("current-year") ? intOption(cmd, "current-year", 0) : null;
            if (cmd.hasOption("year")) {
                int year = intOption(cmd, "year", 0);
                if (cmd.hasOption("download")) {
                    download(config, loader, ticker, List.of(year));
                }
                return previewYear(config, loader, ticker, year);
            }
            if (currentYear == null) {
                currentYear = cmd.hasOption("download") ? Year.now().getValue() : latestYearPlusOne(loader, ticker);
            }
            if (currentYear == null) {
                System.err.println("ERROR: no files found for ticker " + ticker + " in " + inputDir);
                return 1;
            }
            List<Integer> years = new ArrayList<>();
            for (int y = currentYear - yearsBack; y < currentYear; y++) {
                years.add(y);
            }
            if (cmd.hasOption("download")) {
                download(config, loader, ticker, years);
            }
            ProjectionParams params = buildParams(cmd, config, currentYear);
            Double currentPrice = cmd.hasOption("current-price")
                    ? Double.parseDouble(cmd.getOptionValue("current-price").trim())
                    : null;
            return forecast(config, loader, ticker, years, params, outputsDir, currentPrice);
        } catch (NumberFormatException e) {
            System.err.println("ERROR: invalid number: " + e.getMessage());
            return 2;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.err.println("ERROR: interrupted");
            return 1;
        } catch (IOException | RuntimeException e) {
            System.err.println("ERROR: " + e.getMessage());
            return 1;
        }
    }

    private int forecast(
            Config config,
            FactDocumentLoader loader,
            String ticker,
            List<Integer> years,
            ProjectionParams params,
            Path outputsDir,
            Double currentPrice
    ) throws IOException {
        Map<Integer, FactNode> documents = loader.loadYears(ticker, years);
        if (documents.isEmpty()) {
            System.err.println("ERROR: no fact documents for " + ticker + " years=" + years);
            return 1;
        }
        ForecastService service = ForecastService.fromConfig(config);
        Outcome<ForecastRun> outcome = service.run(documents, params);
        if (!outcome.success) {
            System.err.println("ERROR: forecast failed " + outcome.describe());
            return 1;
        }
        ForecastRun run = outcome.value;
        Path dir = new ProjectionExporter().export(ticker, run, outputsDir, currentPrice);
        System.out.println("History years: " + run.history.years());
        for (Scenario scenario : Scenario.values()) {
            ValuationSummary v = run.valuation(scenario);
            if (v == null) {
                System.out.println(scenario.key + ": valuation unavailable " + run.valuations.get(scenario).describe());
                continue;
            }
            System.out.println(String.format(Locale.US, "%s: dcf=%,.0f earnings=%s pe=%.1f",
                    scenario.key, v.dcfValue,
                    v.earningsValue == null ? "n/a" : String.format(Locale.US, "%,.0f", v.earningsValue),
                    v.peMultiple));
        }
        System.out.println("Outputs written to " + dir.toAbsolutePath());
        return 0;
    }

    private int previewYear(Config config, FactDocumentLoader loader, String ticker, int year) throws IOException {
        FactNode document = loader.load(ticker, year);
        Outcome<MetricRecord> outcome = ForecastService.fromConfig(config).extractYear(document, year);
        if (!outcome.success) {
            System.err.println("ERROR: extraction failed " + outcome.describe());
            return 1;
        }
        System.out.println("Metrics for " + ticker + " " + year + ":");
        for (Metric metric : Metric.values()) {
            Double value = outcome.value.get(metric);
            System.out.println(String.format(Locale.US, "  %-18s %s", metric.key, value == null ? "-" : String.format(Locale.US, "%,.4f", value)));
        }
        return 0;
    }

    private int listAvailable(FactDocumentLoader loader) throws IOException {
        Map<String, List<Integer>> available = loader.listAvailable();
        if (available.isEmpty()) {
            System.out.println("No fact documents in " + loader.inputDir());
            return 0;
        }
        System.out.println("Available fact documents in " + loader.inputDir() + ":");
        for (Map.Entry<String, List<Integer>> e : available.entrySet()) {
            System.out.println("  " + e.getKey() + ": " + e.getValue());
        }
        return 0;
    }

    private void download(Config config, FactDocumentLoader loader, String ticker, List<Integer> years)
            throws IOException, InterruptedException {
        SecCompanyFactsClient client = new SecCompanyFactsClient(SecClientSettings.fromConfig(config));
        Map<Integer, JSONObject> documents = client.download(ticker, years);
        for (Map.Entry<Integer, JSONObject> e : documents.entrySet()) {
            Path saved = loader.save(ticker, e.getKey(), e.getValue());
            System.out.println("Saved " + saved);
        }
    }

    private ProjectionParams buildParams(CommandLine cmd, Config config, int currentYear) {
        ProjectionParams.Builder builder = ForecastSettings.projectionParams(config).startYear(currentYear);
        if (cmd.hasOption("proj-years")) {
            builder.years(intOption(cmd, "proj-years", ProjectionParams.DEFAULT_YEARS));
        }
        for (Scenario scenario : Scenario.values()) {
            String opt = "growth-" + scenario.key;
            if (cmd.hasOption(opt)) {
                builder.growth(scenario, Double.parseDouble(cmd.getOptionValue(opt).trim()));
            }
        }
        return builder.build();
    }

    private static Integer latestYearPlusOne(FactDocumentLoader loader, String ticker) throws IOException {
        Integer latest = loader.latestYear(ticker);
        return latest == null ? null : latest + 1;
    }

    private Path optionPath(CommandLine cmd, String opt, Path fallback) {
        String raw = cmd.getOptionValue(opt);
        if (raw == null || raw.trim().isEmpty()) {
            return fallback;
        }
        return workingDir.resolve(raw.trim()).normalize();
    }

    private static int intOption(CommandLine cmd, String opt, int fallback) {
        String raw = cmd.getOptionValue(opt);
        if (raw == null || raw.trim().isEmpty()) {
            return fallback;
        }
        return Integer.parseInt(raw.trim());
    }

    private void installLogRoutingIfNeeded(Path outputsDir) {
        if (LOG_ROUTE_INSTALLED) {
            return;
        }
        synchronized (FinForecastApplication.class) {
            if (LOG_ROUTE_INSTALLED) {
                return;
            }
            try {
                Path logDir = outputsDir.resolve("log");
                Files.createDirectories(logDir);
                System.setProperty("finforecast.log.dir", logDir.toAbsolutePath().toString());

                // Init Log4j context first, so ConsoleAppender keeps original stdout/stderr streams.
                LogManager.getLogger(FinForecastApplication.class);
                System.setOut(IoBuilder.forLogger("STDOUT").setLevel(Level.INFO).buildPrintStream());
                System.setErr(IoBuilder.forLogger("STDERR").setLevel(Level.ERROR).buildPrintStream());

                LOG_ROUTE_INSTALLED = true;
            } catch (IOException e) {
                System.err.println("WARN: failed to initialize log4j routing: " + e.getMessage());
            }
        }
    }

    private Options buildOptions() {
        Options options = new Options();
        options.addOption(Option.builder().longOpt("ticker").hasArg().argName("symbol").desc("ticker symbol, e.g. AAPL").build());
        options.addOption(Option.builder().longOpt("current-year").hasArg().argName("year").desc("first projected year; history ends the year before").build());
        options.addOption(Option.builder().longOpt("years-back").hasArg().argName("n").desc("number of historical years to load (default 5)").build());
        options.addOption(Option.builder().longOpt("proj-years").hasArg().argName("n").desc("number of years to project (default 5)").build());
        options.addOption(Option.builder().longOpt("growth-bear").hasArg().argName("rate").desc("bear case revenue growth, e.g. 0.02").build());
        options.addOption(Option.builder().longOpt("growth-base").hasArg().argName("rate").desc("base case revenue growth, e.g. 0.05").build());
        options.addOption(Option.builder().longOpt("growth-bull").hasArg().argName("rate").desc("bull case revenue growth, e.g. 0.09").build());
        options.addOption(Option.builder().longOpt("current-price").hasArg().argName("price").desc("latest share price; also writes implied price paths").build());
        options.addOption(Option.builder().longOpt("input-dir").hasArg().argName("dir").desc("directory with TICKER_YEAR.json fact documents").build());
        options.addOption(Option.builder().longOpt("out-dir").hasArg().argName("dir").desc("output directory").build());
        options.addOption(Option.builder().longOpt("download").desc("download company facts from the SEC into the input directory first").build());
        options.addOption(Option.builder().longOpt("year").hasArg().argName("year").desc("extract and print a single year, then exit").build());
        options.addOption(Option.builder().longOpt("list-available").desc("list tickers and years in the input directory").build());
        options.addOption(Option.builder().longOpt("help").desc("show help").build());
        return options;
    }
}
