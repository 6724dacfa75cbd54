package com.assetcore;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetcore.blob.ArtifactBlobCache;
import com.assetcore.blob.BlobFetcher;
import com.assetcore.blob.BlobHandle;
import com.assetcore.blob.BlobResolutionException;
import com.assetcore.blob.BlobScope;
import com.assetcore.blob.SpoolFileHandleFactory;
import com.assetcore.fragment.FragmentCollection;
import com.assetcore.fragment.FragmentDeletionException;
import com.assetcore.fragment.FragmentEntry;
import com.assetcore.fragment.FragmentRemote;
import com.assetcore.fragment.FragmentSortMode;
import com.assetcore.hierarchy.Artifact;
import com.assetcore.hierarchy.ChildArtifact;
import com.assetcore.hierarchy.ChildLister;
import com.assetcore.hierarchy.ChildListingException;
import com.assetcore.hierarchy.ChildLoadState;
import com.assetcore.hierarchy.HierarchicalArtifactStore;
import com.assetcore.remote.HttpAssetReader;
import com.assetcore.remote.HttpBlobFetcher;
import com.assetcore.remote.HttpChildLister;
import com.assetcore.remote.HttpFragmentRemote;
import com.assetcore.remote.RemoteApiClient;
import com.assetcore.runtime.AppConfig;
import com.assetcore.runtime.ConfigLoader;
import com.assetcore.table.EmptyInputException;
import com.assetcore.table.TableColumn;
import com.assetcore.table.TableEditSession;
import com.assetcore.table.TableGrid;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
        name = "asset-core",
        mixinStandardHelpOptions = true,
        version = "asset-core 0.1.0",
        description = "Inspect catalog artifacts: delimited tables, blobs, child artifacts and curated fragments.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_ERROR = 2;
    static final int EXIT_REMOTE_FAILURE = 3;
    static final int EXIT_TABLE_INPUT_ERROR = 4;

    @Spec
    CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", required = true)
    Mode mode;

    @Option(names = "--input", description = "Delimited text file read in table mode")
    Path input;

    @Option(names = "--output", description = "Export target in table mode, download target in blob mode")
    Path output;

    @Option(names = "--set", description = "Cell edit in table mode as <row>:<column>=<value>; row is the 1-based row number, column a key or header name")
    List<String> edits = new ArrayList<>();

    @Option(names = "--blob-path", description = "Blob path resolved in blob mode")
    String blobPath;

    @Option(names = "--asset-id", description = "Artifact id used in children and fragments modes")
    Long assetId;

    @Option(names = "--sort", description = "Fragment order: ${COMPLETION-CANDIDATES}", defaultValue = "ALPHABETICAL")
    FragmentSortMode sortMode;

    @Option(names = "--delete", description = "Fragment key deleted in fragments mode")
    String deleteKey;

    private RemoteApiClient apiClient;

    enum Mode {
        table,
        blob,
        children,
        fragments
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = ConfigLoader.load(configPath);
        log.info("Starting asset-core in {} mode", mode);
        log.debug("Using config file: {}", configPath);

        try {
            switch (mode) {
                case table:
                    return runTable();
                case blob:
                    return runBlob(config);
                case children:
                    return runChildren(config);
                case fragments:
                    return runFragments(config);
                default:
                    return EXIT_USAGE_ERROR;
            }
        } catch (EmptyInputException e) {
            log.error("No data in {}: {}", input, e.getMessage());
            return EXIT_TABLE_INPUT_ERROR;
        } catch (BlobResolutionException | ChildListingException | FragmentDeletionException e) {
            log.error("{}", e.getMessage(), e);
            return EXIT_REMOTE_FAILURE;
        } catch (CompletionException | UncheckedIOException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Remote request failed: {}", cause.getMessage(), cause);
            return EXIT_REMOTE_FAILURE;
        }
    }

    int runTable() throws IOException {
        if (input == null) {
            log.error("--input is required in table mode");
            return EXIT_USAGE_ERROR;
        }
        TableEditSession session = new TableEditSession(Files.readString(input));
        TableGrid grid = session.grid();
        log.info("table.parsed input={} delimiter={} columns={} rows={}",
                input,
                describeDelimiter(grid.sourceDelimiter()),
                grid.dataColumns().size(),
                grid.rowCount());

        for (String edit : edits) {
            CellEdit cellEdit;
            try {
                cellEdit = CellEdit.parse(edit, grid);
            } catch (IllegalArgumentException e) {
                log.error("Invalid --set '{}': {}", edit, e.getMessage());
                return EXIT_USAGE_ERROR;
            }
            session.editCell(cellEdit.rowIndex(), cellEdit.columnKey(), cellEdit.value());
        }

        PrintWriter out = spec.commandLine().getOut();
        if (output != null) {
            session.exportTo(output);
            out.printf("Wrote %d rows to %s%n", session.grid().rowCount(), output);
        } else {
            out.println(session.exportText());
        }
        out.flush();
        return EXIT_OK;
    }

    int runBlob(AppConfig config) throws IOException {
        if (blobPath == null || blobPath.isBlank()) {
            log.error("--blob-path is required in blob mode");
            return EXIT_USAGE_ERROR;
        }
        Path target = output != null ? output : Path.of(fileNameOf(blobPath));
        ArtifactBlobCache cache = new ArtifactBlobCache(
                createBlobFetcher(config),
                new SpoolFileHandleFactory(Path.of(config.getCache().getSpoolDir())));
        try (BlobScope scope = cache.openScope()) {
            BlobHandle handle = await(scope.resolve(blobPath));
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.copy(handle.localFile(), target, StandardCopyOption.REPLACE_EXISTING);
            PrintWriter out = spec.commandLine().getOut();
            out.printf("Downloaded %s (%d bytes) to %s%n", blobPath, handle.size(), target);
            out.flush();
        } finally {
            cache.releaseAll();
        }
        return EXIT_OK;
    }

    int runChildren(AppConfig config) {
        if (assetId == null) {
            log.error("--asset-id is required in children mode");
            return EXIT_USAGE_ERROR;
        }
        Artifact parent = await(readAsset(config, assetId));
        if (!parent.isHierarchical()) {
            log.warn("Artifact {} of kind {} is not hierarchical", parent.id(), parent.kind().value());
        }
        ArtifactBlobCache cache = new ArtifactBlobCache(
                createBlobFetcher(config),
                new SpoolFileHandleFactory(Path.of(config.getCache().getSpoolDir())));
        HierarchicalArtifactStore store = new HierarchicalArtifactStore(createChildLister(config), cache);
        try {
            store.observeParent(parent);
            List<ChildArtifact> children = await(store.loadChildren(parent.id()));

            // the catalog may have decomposed further while the listing ran
            Artifact current = await(readAsset(config, parent.id()));
            ChildLoadState state = store.observeParent(current);
            if (state.status() == ChildLoadState.Status.LOADING) {
                children = await(store.loadChildren(parent.id()));
            } else if (state.status() == ChildLoadState.Status.ERROR) {
                log.error("{}", state.errorMessage());
                return EXIT_REMOTE_FAILURE;
            } else {
                children = state.children();
            }
            if (children.size() != current.declaredChildCount()) {
                log.warn("children.count.mismatch parentId={} listed={} declared={}",
                        current.id(), children.size(), current.declaredChildCount());
            }
            PrintWriter out = spec.commandLine().getOut();
            out.printf("Artifact %d has %d children (declared %d)%n",
                    current.id(), children.size(), current.declaredChildCount());
            for (ChildArtifact child : children) {
                out.printf("%5d  id=%d  kind=%s  %s%n",
                        child.partIndex(),
                        child.id(),
                        child.artifact().kind().value(),
                        Optional.ofNullable(child.artifact().title()).orElse(""));
            }
            out.flush();
        } finally {
            cache.releaseAll();
        }
        return EXIT_OK;
    }

    int runFragments(AppConfig config) {
        if (assetId == null) {
            log.error("--asset-id is required in fragments mode");
            return EXIT_USAGE_ERROR;
        }
        Artifact asset = await(readAsset(config, assetId));
        FragmentCollection fragments = FragmentCollection.fromJson(asset.id(), asset.fragments(), createFragmentRemote(config));
        if (deleteKey != null) {
            try {
                await(fragments.delete(deleteKey));
                log.info("Deleted fragment {} of artifact {}", deleteKey, asset.id());
            } catch (FragmentDeletionException e) {
                e.removedEntry().ifPresent(fragments::put);
                throw e;
            }
        }
        PrintWriter out = spec.commandLine().getOut();
        for (FragmentEntry entry : fragments.sortedEntries(sortMode)) {
            out.printf("%s = %s%s%n",
                    entry.displayKey(),
                    entry.valueText(),
                    entry.sourceRunId().map(id -> "  (run " + id + ")").orElse(""));
        }
        out.flush();
        return EXIT_OK;
    }

    BlobFetcher createBlobFetcher(AppConfig config) {
        return new HttpBlobFetcher(apiClient(config));
    }

    ChildLister createChildLister(AppConfig config) {
        return new HttpChildLister(apiClient(config), config.getApi().getChildPageSize());
    }

    FragmentRemote createFragmentRemote(AppConfig config) {
        return new HttpFragmentRemote(apiClient(config));
    }

    CompletableFuture<Artifact> readAsset(AppConfig config, long id) {
        return new HttpAssetReader(apiClient(config)).read(id);
    }

    private RemoteApiClient apiClient(AppConfig config) {
        if (apiClient == null) {
            apiClient = RemoteApiClient.fromConfig(config.getApi(), System.getenv());
        }
        return apiClient;
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw e;
        }
    }

    static String describeDelimiter(char delimiter) {
        switch (delimiter) {
            case '\t':
                return "tab";
            case ',':
                return "comma";
            case ';':
                return "semicolon";
            case '|':
                return "pipe";
            default:
                return String.valueOf(delimiter);
        }
    }

    private static String fileNameOf(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        return name.isBlank() ? "blob.bin" : name;
    }

    record CellEdit(int rowIndex, String columnKey, String value) {
        static CellEdit parse(String raw, TableGrid grid) {
            int colon = raw.indexOf(':');
            int equals = raw.indexOf('=', colon + 1);
            if (colon <= 0 || equals < 0) {
                throw new IllegalArgumentException("expected <row>:<column>=<value>");
            }
            int rowNumber;
            try {
                rowNumber = Integer.parseInt(raw.substring(0, colon).trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("row must be a number");
            }
            if (rowNumber < 1 || rowNumber > grid.rowCount()) {
                throw new IllegalArgumentException("row " + rowNumber + " outside 1.." + grid.rowCount());
            }
            String column = raw.substring(colon + 1, equals).trim();
            String key = grid.dataColumns().stream()
                    .filter(c -> c.key().equals(column) || c.name().toLowerCase(Locale.ROOT).equals(column.toLowerCase(Locale.ROOT)))
                    .map(TableColumn::key)
                    .findFirst()
                    .orElseThrow(() -> new IllegalArgumentException("unknown column " + column));
            return new CellEdit(rowNumber - 1, key, raw.substring(equals + 1));
        }
    }
}
