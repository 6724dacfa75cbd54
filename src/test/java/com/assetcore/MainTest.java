package com.assetcore;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.assetcore.blob.BlobFetcher;
import com.assetcore.fragment.FragmentRemote;
import com.assetcore.hierarchy.Artifact;
import com.assetcore.hierarchy.ArtifactKind;
import com.assetcore.hierarchy.ChildArtifact;
import com.assetcore.hierarchy.ChildLister;
import com.assetcore.runtime.AppConfig;
import com.fasterxml.jackson.databind.json.JsonMapper;

import picocli.CommandLine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MainTest {

    @TempDir
    Path tempDir;

    private final StringWriter stdout = new StringWriter();

    private int run(Main main, String... args) {
        CommandLine commandLine = new CommandLine(main).setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setOut(new PrintWriter(stdout));
        commandLine.setErr(new PrintWriter(new StringWriter()));
        return commandLine.execute(args);
    }

    private Path config() throws IOException {
        Path config = tempDir.resolve("application.yml");
        Files.writeString(config, """
                api:
                  baseUrl: http://catalog.invalid
                cache:
                  spoolDir: %s
                """.formatted(tempDir.resolve("spool").toString().replace('\\', '/')));
        return config;
    }

    @Test
    void shouldRejectMissingMode() {
        assertEquals(2, run(new Main()));
    }

    @Test
    void shouldPrintEditedTable() throws IOException {
        Path input = tempDir.resolve("people.csv");
        Files.writeString(input, "name;city\nAda;London\nAlan;Wilmslow\n");

        int exitCode = run(new Main(),
                "--mode", "table",
                "--config", config().toString(),
                "--input", input.toString(),
                "--set", "2:City=Manchester, UK");

        assertEquals(0, exitCode);
        assertEquals("\"name\",\"city\"\nAda,London\nAlan,\"Manchester, UK\"", stdout.toString().trim());
    }

    @Test
    void shouldEchoUneditedTableVerbatim() throws IOException {
        Path input = tempDir.resolve("raw.tsv");
        Files.writeString(input, "a\tb\n1\t2");

        assertEquals(0, run(new Main(), "--mode", "table", "--config", config().toString(), "--input", input.toString()));
        assertEquals("a\tb\n1\t2", stdout.toString().trim());
    }

    @Test
    void shouldExportTableToFile() throws IOException {
        Path input = tempDir.resolve("in.csv");
        Path output = tempDir.resolve("out/edited.csv");
        Files.writeString(input, "x,y\n1,2\n");

        int exitCode = run(new Main(),
                "--mode", "TABLE",
                "--config", config().toString(),
                "--input", input.toString(),
                "--set", "1:col_1=3",
                "--output", output.toString());

        assertEquals(0, exitCode);
        assertEquals("\"x\",\"y\"\n1,3", Files.readString(output));
        assertTrue(stdout.toString().startsWith("Wrote 1 rows to "));
    }

    @Test
    void shouldRejectMalformedCellEdit() throws IOException {
        Path input = tempDir.resolve("in.csv");
        Files.writeString(input, "x,y\n1,2\n");

        assertEquals(2, run(new Main(), "--mode", "table", "--config", config().toString(),
                "--input", input.toString(), "--set", "9:x=1"));
        assertEquals(2, run(new Main(), "--mode", "table", "--config", config().toString(),
                "--input", input.toString(), "--set", "1:#=1"));
        assertEquals(2, run(new Main(), "--mode", "table", "--config", config().toString()));
    }

    @Test
    void shouldReportEmptyTableInput() throws IOException {
        Path input = Files.writeString(tempDir.resolve("blank.csv"), "\n\n");

        assertEquals(4, run(new Main(), "--mode", "table", "--config", config().toString(), "--input", input.toString()));
    }

    @Test
    void shouldDownloadBlobAndReleaseSpoolFile() throws IOException {
        Path output = tempDir.resolve("download/page.png");
        Main main = new Main() {
            @Override
            BlobFetcher createBlobFetcher(AppConfig config) {
                return path -> CompletableFuture.completedFuture("png".getBytes(StandardCharsets.UTF_8));
            }
        };

        int exitCode = run(main, "--mode", "blob", "--config", config().toString(),
                "--blob-path", "3/pages/page.png", "--output", output.toString());

        assertEquals(0, exitCode);
        assertEquals("png", Files.readString(output));
        try (var spooled = Files.list(tempDir.resolve("spool"))) {
            assertEquals(0, spooled.count());
        }
    }

    @Test
    void shouldMapBlobFailureToRemoteExitCode() throws IOException {
        Main main = new Main() {
            @Override
            BlobFetcher createBlobFetcher(AppConfig config) {
                return path -> CompletableFuture.failedFuture(new IOException("HTTP 404"));
            }
        };

        assertEquals(3, run(main, "--mode", "blob", "--config", config().toString(), "--blob-path", "gone.png"));
    }

    @Test
    void shouldListChildrenInPartOrder() throws IOException {
        Main main = new FakeCatalogMain(
                new Artifact(5, null, "Sales", ArtifactKind.CSV, "3/sales.csv", null, null,
                        Map.of("row_count", 2), true, null, null, null, null),
                parentId -> CompletableFuture.completedFuture(List.of(
                        new ChildArtifact(Artifact.of(51, ArtifactKind.CSV_ROW, null, false, null), 1),
                        new ChildArtifact(Artifact.of(50, ArtifactKind.CSV_ROW, null, false, null), 0))),
                new ArrayList<>());

        int exitCode = run(main, "--mode", "children", "--config", config().toString(), "--asset-id", "5");

        assertEquals(0, exitCode);
        String[] lines = stdout.toString().split("\\R");
        assertEquals("Artifact 5 has 2 children (declared 2)", lines[0]);
        assertTrue(lines[1].contains("id=50"));
        assertTrue(lines[2].contains("id=51"));
    }

    @Test
    void shouldReloadChildrenWhenDeclaredCountGrewDuringListing() throws IOException {
        List<Integer> listingSizes = new ArrayList<>();
        ChildLister lister = parentId -> {
            int size = listingSizes.isEmpty() ? 2 : 3;
            listingSizes.add(size);
            List<ChildArtifact> rows = new ArrayList<>();
            for (int i = 0; i < size; i++) {
                rows.add(new ChildArtifact(Artifact.of(100 + i, ArtifactKind.PDF_PAGE, null, false, null), i));
            }
            return CompletableFuture.completedFuture(rows);
        };
        Main main = new FakeCatalogMain(
                List.of(Artifact.of(9, ArtifactKind.PDF, "a.pdf", true, 2), Artifact.of(9, ArtifactKind.PDF, "a.pdf", true, 3)),
                lister,
                new ArrayList<>());

        int exitCode = run(main, "--mode", "children", "--config", config().toString(), "--asset-id", "9");

        assertEquals(0, exitCode);
        assertEquals(List.of(2, 3), listingSizes);
        assertTrue(stdout.toString().startsWith("Artifact 9 has 3 children (declared 3)"), stdout.toString());
    }

    @Test
    void shouldReportFailedReconciliationReload() throws IOException {
        List<Long> listed = new ArrayList<>();
        ChildLister lister = parentId -> {
            listed.add(parentId);
            if (listed.size() > 1) {
                return CompletableFuture.failedFuture(new IOException("HTTP 503"));
            }
            return CompletableFuture.completedFuture(List.of());
        };
        Main main = new FakeCatalogMain(
                List.of(Artifact.of(9, ArtifactKind.PDF, "a.pdf", true, 0), Artifact.of(9, ArtifactKind.PDF, "a.pdf", true, 4)),
                lister,
                new ArrayList<>());

        assertEquals(3, run(main, "--mode", "children", "--config", config().toString(), "--asset-id", "9"));
        assertEquals(2, listed.size());
    }

    @Test
    void shouldListOnceWhenDeclaredCountIsStable() throws IOException {
        List<Long> listed = new ArrayList<>();
        Main main = new FakeCatalogMain(
                Artifact.of(9, ArtifactKind.PDF, "a.pdf", true, 1),
                parentId -> {
                    listed.add(parentId);
                    return CompletableFuture.completedFuture(List.of(
                            new ChildArtifact(Artifact.of(100, ArtifactKind.PDF_PAGE, null, false, null), 0)));
                },
                new ArrayList<>());

        assertEquals(0, run(main, "--mode", "children", "--config", config().toString(), "--asset-id", "9"));
        assertEquals(List.of(9L), listed);
    }

    @Test
    void shouldMapChildListingFailureToRemoteExitCode() throws IOException {
        Main main = new FakeCatalogMain(
                Artifact.of(5, ArtifactKind.PDF, "a.pdf", true, 3),
                parentId -> CompletableFuture.failedFuture(new IOException("HTTP 502")),
                new ArrayList<>());

        assertEquals(3, run(main, "--mode", "children", "--config", config().toString(), "--asset-id", "5"));
    }

    @Test
    void shouldPrintAndDeleteFragments() throws Exception {
        List<String> deleted = new ArrayList<>();
        Main main = new FakeCatalogMain(withFragments(), parentId -> CompletableFuture.completedFuture(List.of()), deleted);

        int exitCode = run(main, "--mode", "fragments", "--config", config().toString(),
                "--asset-id", "8", "--delete", "fragment.obsolete");

        assertEquals(0, exitCode);
        assertEquals(List.of("8:fragment.obsolete"), deleted);
        String output = stdout.toString();
        assertTrue(output.contains("title = Annual report  (run 42)"), output);
        assertTrue(output.contains("author = Ada"), output);
        assertFalse(output.contains("obsolete"), output);
    }

    @Test
    void shouldMapFragmentDeletionFailureToRemoteExitCode() throws Exception {
        Main main = new FakeCatalogMain(withFragments(), parentId -> CompletableFuture.completedFuture(List.of()), null);

        assertEquals(3, run(main, "--mode", "fragments", "--config", config().toString(),
                "--asset-id", "8", "--delete", "fragment.obsolete"));
    }

    @Test
    void shouldRequireAssetId() throws IOException {
        assertEquals(2, run(new Main(), "--mode", "children", "--config", config().toString()));
        assertEquals(2, run(new Main(), "--mode", "fragments", "--config", config().toString()));
    }

    @Test
    void shouldDescribeDelimiters() {
        assertEquals("tab", Main.describeDelimiter('\t'));
        assertEquals("semicolon", Main.describeDelimiter(';'));
    }

    private static Artifact withFragments() throws IOException {
        return JsonMapper.builder().findAndAddModules().build().readValue("""
                {
                  "id": 8,
                  "kind": "pdf",
                  "fragments": {
                    "document.title": {"value": "Annual report", "source_ref": "annotation_run:42"},
                    "fragment.author": "Ada",
                    "fragment.obsolete": "x"
                  }
                }
                """, Artifact.class);
    }

    /**
     * Serves one artifact and a fixed child listing. A null {@code deleted} list makes fragment deletion fail.
     */
    static class FakeCatalogMain extends Main {
        private final List<Artifact> reads;
        private final ChildLister lister;
        private final List<String> deleted;
        private int readCount;

        FakeCatalogMain(Artifact artifact, ChildLister lister, List<String> deleted) {
            this(List.of(artifact), lister, deleted);
        }

        FakeCatalogMain(List<Artifact> reads, ChildLister lister, List<String> deleted) {
            this.reads = reads;
            this.lister = lister;
            this.deleted = deleted;
        }

        @Override
        CompletableFuture<Artifact> readAsset(AppConfig config, long id) {
            Artifact next = reads.get(Math.min(readCount, reads.size() - 1));
            readCount++;
            return CompletableFuture.completedFuture(next);
        }

        @Override
        ChildLister createChildLister(AppConfig config) {
            return lister;
        }

        @Override
        BlobFetcher createBlobFetcher(AppConfig config) {
            return path -> CompletableFuture.failedFuture(new IOException("no blobs"));
        }

        @Override
        FragmentRemote createFragmentRemote(AppConfig config) {
            return (artifactId, key) -> {
                if (deleted == null) {
                    return CompletableFuture.failedFuture(new IOException("HTTP 403"));
                }
                deleted.add(artifactId + ":" + key);
                return CompletableFuture.completedFuture(null);
            };
        }
    }
}
