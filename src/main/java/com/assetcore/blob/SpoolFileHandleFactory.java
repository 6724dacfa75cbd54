package com.assetcore.blob;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SpoolFileHandleFactory implements BlobHandleFactory {
    private static final Logger log = LoggerFactory.getLogger(SpoolFileHandleFactory.class);
    private static final int MAX_SUFFIX_LENGTH = 8;

    private final Path spoolDir;

    public SpoolFileHandleFactory(Path spoolDir) {
        this.spoolDir = spoolDir;
    }

    @Override
    public BlobHandle create(String blobPath, byte[] content) throws IOException {
        Files.createDirectories(spoolDir);
        Path file = Files.createTempFile(spoolDir, "blob-", suffixOf(blobPath));
        Files.write(file, content);
        return new SpoolFileHandle(blobPath, file, content.length);
    }

    public Path spoolDir() {
        return spoolDir;
    }

    static String suffixOf(String blobPath) {
        int slash = blobPath.lastIndexOf('/');
        String name = blobPath.substring(slash + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return ".bin";
        }
        String extension = name.substring(dot).toLowerCase(Locale.ROOT);
        if (extension.length() > MAX_SUFFIX_LENGTH || !extension.substring(1).chars().allMatch(Character::isLetterOrDigit)) {
            return ".bin";
        }
        return extension;
    }

    private static final class SpoolFileHandle implements BlobHandle {
        private final String blobPath;
        private final Path file;
        private final long size;
        private final AtomicBoolean released = new AtomicBoolean(false);

        private SpoolFileHandle(String blobPath, Path file, long size) {
            this.blobPath = blobPath;
            this.file = file;
            this.size = size;
        }

        @Override
        public String blobPath() {
            return blobPath;
        }

        @Override
        public Path localFile() {
            return file;
        }

        @Override
        public long size() {
            return size;
        }

        @Override
        public boolean isReleased() {
            return released.get();
        }

        @Override
        public void release() {
            if (!released.compareAndSet(false, true)) {
                return;
            }
            try {
                Files.deleteIfExists(file);
            } catch (IOException e) {
                log.warn("blob.release.failed path={} file={}", blobPath, file, e);
            }
        }

        @Override
        public String toString() {
            return "SpoolFileHandle{" +
                    "blobPath='" + blobPath + '\'' +
                    ", file=" + file +
                    ", size=" + size +
                    ", released=" + released.get() +
                    '}';
        }
    }
}
