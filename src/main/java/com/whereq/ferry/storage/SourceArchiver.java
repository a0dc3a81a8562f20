package com.whereq.ferry.storage;

import com.google.common.hash.Hashing;
import com.google.common.io.MoreFiles;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes tar.gz archives of source files and hashes them
 */
@Component
public class SourceArchiver {

    /**
     * Archive {@code files} into {@code target}. Entry names are relative to {@code root}
     * and use forward slashes. Files are written in the given order. Only name, size and
     * modification time are recorded, so unchanged files always produce the same bytes.
     */
    public void writeTarGz(Path root, List<Path> files, Path target) throws IOException {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target));
             TarArchiveOutputStream tar = new TarArchiveOutputStream(
                 new GzipCompressorOutputStream(out), StandardCharsets.UTF_8.name())) {
            tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
            tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);

            for (Path file : files) {
                String entryName = root.relativize(file).toString().replace('\\', '/');
                TarArchiveEntry entry = new TarArchiveEntry(entryName);
                entry.setSize(Files.size(file));
                entry.setModTime(Files.getLastModifiedTime(file));
                tar.putArchiveEntry(entry);
                try {
                    Files.copy(file, tar);
                } finally {
                    tar.closeArchiveEntry();
                }
            }
            tar.finish();
        }
    }

    /**
     * Hex sha256 of the file contents
     */
    public String sha256(Path file) throws IOException {
        return MoreFiles.asByteSource(file).hash(Hashing.sha256()).toString();
    }
}
