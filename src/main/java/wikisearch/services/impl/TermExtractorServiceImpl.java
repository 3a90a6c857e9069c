package wikisearch.services.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import wikisearch.services.TermExtractorService;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Service
public class TermExtractorServiceImpl implements TermExtractorService {
    private static final Pattern QUERY_MARKER = Pattern.compile("query=\"([^\"]+)\"");

    @Override
    public Set<String> extractTerms(Path logFile) {
        Set<String> terms = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(logFile), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                Matcher matcher = QUERY_MARKER.matcher(line);
                if (!matcher.find()) {
                    continue;
                }
                String term = matcher.group(1).trim().toLowerCase(Locale.ROOT);
                if (term.isEmpty()) {
                    continue;
                }
                if (terms.add(term)) {
                    log.debug("Extracted search term: {}", term);
                }
            }
        } catch (IOException e) {
            log.warn("Could not read query log {}: {}", logFile, e.toString());
            return new HashSet<>();
        }
        log.info("Extracted {} unique search terms from {}", terms.size(), logFile);
        return terms;
    }
}
