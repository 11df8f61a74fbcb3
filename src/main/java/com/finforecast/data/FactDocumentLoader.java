package com.finforecast.data;

import com.finforecast.facts.FactNode;
import com.finforecast.facts.FactNodes;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Finds and reads one fact document per ticker and fiscal year from a local directory.
 * <p>
 * Name lookup order: {@code T_YYYY.json} as given, upper case, lower case, then the same three with
 * an {@code _xbrl} suffix, then any {@code *.json} whose name contains both ticker and year.
 */
public final class FactDocumentLoader {
    private static final Logger LOG = LogManager.getLogger(FactDocumentLoader.class);

    private final Path inputDir;

    public FactDocumentLoader(Path inputDir) {
        this.inputDir = inputDir;
    }

    public Path inputDir() {
        return inputDir;
    }

    public Path resolve(String ticker, int year) throws IOException {
        for (String name : candidateNames(ticker, year)) {
            Path path = inputDir.resolve(name);
            if (Files.isRegularFile(path)) {
                return path;
            }
        }
        String upper = ticker.toUpperCase(Locale.ROOT);
        String yearText = String.valueOf(year);
        for (Path file : jsonFiles()) {
            String name = file.getFileName().toString();
            if (name.toUpperCase(Locale.ROOT).contains(upper) && name.contains(yearText)) {
                return file;
            }
        }
        throw new NoSuchFileException(inputDir.resolve(ticker + "_" + year + ".json").toString(), null,
                "no fact document for " + ticker + " " + year + "; tried " + candidateNames(ticker, year));
    }

    public FactNode load(String ticker, int year) throws IOException {
        Path path = resolve(ticker, year);
        LOG.debug("loading fact document {}", path);
        String text = Files.readString(path, StandardCharsets.UTF_8);
        try {
            return FactNodes.parse(text);
        } catch (JSONException e) {
            throw new IOException("invalid JSON in " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Documents for every requested year that has a readable file; the rest are logged and skipped.
     */
    public Map<Integer, FactNode> loadYears(String ticker, List<Integer> years) {
        Map<Integer, FactNode> out = new LinkedHashMap<>();
        List<Integer> missing = new ArrayList<>();
        for (Integer year : years) {
            try {
                out.put(year, load(ticker, year));
            } catch (NoSuchFileException e) {
                missing.add(year);
            } catch (IOException e) {
                LOG.warn("skipping ticker={} year={} err={}", ticker, year, e.getMessage());
            }
        }
        if (!missing.isEmpty()) {
            LOG.warn("missing files ticker={} years={} dir={}", ticker, missing, inputDir);
        }
        return out;
    }

    /**
     * Tickers (upper case) with the years that have a file named {@code TICKER_YEAR*.json}.
     */
    public Map<String, List<Integer>> listAvailable() throws IOException {
        Map<String, TreeSet<Integer>> found = new TreeMap<>();
        for (Path file : jsonFiles()) {
            String stem = file.getFileName().toString();
            stem = stem.substring(0, stem.length() - ".json".length());
            String[] parts = stem.split("_");
            if (parts.length < 2) {
                continue;
            }
            try {
                int year = Integer.parseInt(parts[1]);
                found.computeIfAbsent(parts[0].toUpperCase(Locale.ROOT), k -> new TreeSet<>()).add(year);
            } catch (NumberFormatException e) {
                LOG.debug("ignoring file without a year: {}", file.getFileName());
            }
        }
        Map<String, List<Integer>> out = new TreeMap<>();
        for (Map.Entry<String, TreeSet<Integer>> e : found.entrySet()) {
            out.put(e.getKey(), new ArrayList<>(e.getValue()));
        }
        return out;
    }

    public Integer latestYear(String ticker) throws IOException {
        List<Integer> years = listAvailable().get(ticker.toUpperCase(Locale.ROOT));
        return years == null || years.isEmpty() ? null : years.get(years.size() - 1);
    }

    /**
     * Writes a document under the primary name so later runs can load it.
     */
    public Path save(String ticker, int year, JSONObject document) throws IOException {
        Files.createDirectories(inputDir);
        Path path = inputDir.resolve(ticker.toUpperCase(Locale.ROOT) + "_" + year + ".json");
        Files.writeString(path, document.toString(2), StandardCharsets.UTF_8);
        return path;
    }

    static List<String> candidateNames(String ticker, int year) {
        String upper = ticker.toUpperCase(Locale.ROOT);
        String lower = ticker.toLowerCase(Locale.ROOT);
        List<String> names = new ArrayList<>();
        for (String suffix : new String[]{".json", "_xbrl.json"}) {
            for (String t : new String[]{ticker, upper, lower}) {
                String name = t + "_" + year + suffix;
                if (!names.contains(name)) {
                    names.add(name);
                }
            }
        }
        return names;
    }

    private List<Path> jsonFiles() throws IOException {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(inputDir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(inputDir, "*.json")) {
            for (Path p : stream) {
                if (Files.isRegularFile(p)) {
                    files.add(p);
                }
            }
        }
        files.sort(null);
        return files;
    }
}
