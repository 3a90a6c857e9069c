package wikisearch.services.impl;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TermExtractorServiceImplTest {

    private final TermExtractorServiceImpl extractor = new TermExtractorServiceImpl();

    @TempDir
    Path tempDir;

    @Test
    void collapsesCaseVariantsIntoOneTerm() throws IOException {
        Path log = writeLog(
                "2024/05/01 10:00:00 SEARCH: query=\"Golang\" from=127.0.0.1",
                "2024/05/01 10:00:01 SEARCH: query=\"GOLANG\" from=127.0.0.1",
                "2024/05/01 10:00:02 SEARCH: query=\"golang\" from=127.0.0.1");

        assertThat(extractor.extractTerms(log)).containsExactly("golang");
    }

    @Test
    void trimsAndLowercasesTerms() throws IOException {
        Path log = writeLog(
                "query=\"  Hello World  \" from=10.0.0.1",
                "query=\"Python\"");

        assertThat(extractor.extractTerms(log)).containsExactlyInAnyOrder("hello world", "python");
    }

    @Test
    void ignoresLinesWithoutMarkerAndBlankTerms() throws IOException {
        Path log = writeLog(
                "Search handler called",
                "query=\"   \" from=10.0.0.1",
                "query=\"\" from=10.0.0.1",
                "query=\"java\" from=10.0.0.1");

        assertThat(extractor.extractTerms(log)).containsExactly("java");
    }

    @Test
    void returnsEmptySetForMissingFile() {
        Set<String> terms = extractor.extractTerms(tempDir.resolve("does-not-exist.log"));

        assertThat(terms).isEmpty();
    }

    @Test
    void returnsEmptySetForEmptyFile() throws IOException {
        assertThat(extractor.extractTerms(writeLog())).isEmpty();
    }

    private Path writeLog(String... lines) throws IOException {
        Path file = tempDir.resolve("search.log");
        Files.write(file, java.util.List.of(lines), StandardCharsets.UTF_8);
        return file;
    }
}
