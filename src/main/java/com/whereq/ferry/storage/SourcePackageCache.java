package com.whereq.ferry.storage;

import com.whereq.ferry.config.FerryProperties;
import com.whereq.ferry.exception.ConfigurationException;
import com.whereq.ferry.exception.SourceOutsideWorkdirException;
import com.whereq.ferry.model.SourcePackage;
import com.whereq.ferry.remote.ObjectStoreApi;
import com.whereq.ferry.remote.RemoteCallExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Packages the working directory once per unique content and keeps the uploaded
 * archives around until shutdown.
 */
@Slf4j
@Service
public class SourcePackageCache {

    static final String CONTENT_TYPE = "application/gzip";

    private static final double BYTES_PER_GB = 1024d * 1024d * 1024d;

    private final FerryProperties properties;
    private final ObjectStoreApi objectStore;
    private final RemoteCallExecutor remoteCallExecutor;
    private final SourceArchiver archiver;

    private final Set<SourcePackage> trackedPackages = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    public SourcePackageCache(FerryProperties properties, ObjectStoreApi objectStore,
                              RemoteCallExecutor remoteCallExecutor, SourceArchiver archiver) {
        this.properties = properties;
        this.objectStore = objectStore;
        this.remoteCallExecutor = remoteCallExecutor;
        this.archiver = archiver;
    }

    /**
     * Expand the given files and directories into the list of files to package.
     * Directories are walked recursively; the local cache directory is never included.
     * Oversized files are packaged anyway, with a warning.
     */
    public List<Path> collectSources(Path workdir, Collection<Path> paths) {
        Path cacheDir = cacheDirectory(workdir).toAbsolutePath().normalize();
        List<Path> sources = new ArrayList<>();

        for (Path path : paths) {
            Path absolute = workdir.resolve(path).toAbsolutePath().normalize();
            if (Files.isDirectory(absolute)) {
                try (Stream<Path> walk = Files.walk(absolute)) {
                    walk.filter(Files::isRegularFile)
                        .filter(file -> !file.toAbsolutePath().normalize().startsWith(cacheDir))
                        .forEach(sources::add);
                } catch (IOException e) {
                    throw new UncheckedIOException("Cannot list sources under " + absolute, e);
                }
            } else {
                sources.add(absolute);
            }
        }

        sources.forEach(this::checkSourceSize);
        return sources;
    }

    /**
     * Archive the source files, name the archive by its sha256 and keep it in the local cache.
     * An archive with the same hash already in the cache is reused.
     *
     * @throws SourceOutsideWorkdirException if a file does not resolve to a path under {@code workdir}
     */
    public SourcePackage prepare(Path workdir, Collection<Path> sourceFiles) {
        try {
            Path root = workdir.toRealPath();
            SortedSet<Path> files = new TreeSet<>();
            for (Path file : sourceFiles) {
                Path real = root.resolve(file).toRealPath();
                if (!real.startsWith(root)) {
                    throw new SourceOutsideWorkdirException(root, file);
                }
                files.add(real);
            }

            Path tmp = Files.createTempFile("ferry-", ".tar.gz");
            String sha256;
            try {
                archiver.writeTarGz(root, new ArrayList<>(files), tmp);
                sha256 = archiver.sha256(tmp);
            } catch (IOException | RuntimeException e) {
                Files.deleteIfExists(tmp);
                throw e;
            }

            String fileName = "workdir-" + sha256 + ".tar.gz";
            Path cacheDir = cacheDirectory(root);
            Files.createDirectories(cacheDir);
            Path cached = cacheDir.resolve(fileName);

            if (Files.exists(cached)) {
                Files.delete(tmp);
            } else {
                Files.move(tmp, cached, StandardCopyOption.REPLACE_EXISTING);
            }

            SourcePackage sourcePackage = new SourcePackage(sha256, cached,
                properties.getStorage().getCachePrefix() + "/" + fileName);
            trackedPackages.add(sourcePackage);

            log.info("Prepared source package {} with {} files", sourcePackage.getBlobName(), files.size());
            return sourcePackage;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to build source package of " + workdir, e);
        }
    }

    /**
     * Upload the archive unless a blob with the same name exists
     */
    public void upload(SourcePackage sourcePackage) {
        String bucket = properties.getStorage().bucketName();
        log.debug("build-package={}", sourcePackage.getBlobName());

        remoteCallExecutor.execute(() -> {
            if (Boolean.TRUE.equals(objectStore.blobExists(bucket, sourcePackage.getBlobName()).execute())) {
                log.debug("Source package {} already uploaded", sourcePackage.getBlobName());
                return null;
            }
            byte[] content = readArchive(sourcePackage.getLocalPath());
            return objectStore.upload(bucket, sourcePackage.getBlobName(), content, CONTENT_TYPE).execute();
        });
    }

    /**
     * Remove uploaded packages unless the cache should be kept. A package whose deletion fails
     * stays tracked and the next call tries it again; otherwise only the first call does anything.
     */
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        if (properties.getStorage().isKeepSourceCache()) {
            log.debug("Requested to save workflow sources, skipping cleanup.");
            return;
        }

        String bucket = properties.getStorage().bucketName();
        List<String> failed = new ArrayList<>();
        for (SourcePackage sourcePackage : trackedPackages) {
            try {
                remoteCallExecutor.execute(() -> {
                    if (Boolean.TRUE.equals(objectStore.blobExists(bucket, sourcePackage.getBlobName()).execute())) {
                        log.debug("Deleting blob {}", sourcePackage.getBlobName());
                        objectStore.delete(bucket, sourcePackage.getBlobName()).execute();
                    }
                    return null;
                });
                trackedPackages.remove(sourcePackage);
            } catch (RuntimeException e) {
                log.warn("Failed to delete source package {}: {}", sourcePackage.getBlobName(), e.getMessage());
                failed.add(sourcePackage.getBlobName());
            }
        }

        if (!failed.isEmpty()) {
            shutDown.set(false);
            log.error("{} source package(s) left in bucket {}: {}", failed.size(), bucket, failed);
        }
    }

    public Set<SourcePackage> getTrackedPackages() {
        return Collections.unmodifiableSet(trackedPackages);
    }

    private Path cacheDirectory(Path workdir) {
        return workdir.resolve(properties.getSource().getCacheDir());
    }

    private void checkSourceSize(Path file) {
        try {
            double gb = Files.size(file) / BYTES_PER_GB;
            double limit = properties.getSource().getSizeWarningGb();
            if (gb > limit) {
                log.warn("File {} (size {} GB) is greater than the {} GB suggested size. "
                    + "Consider uploading larger files to storage first.", file, String.format("%.2f", gb), limit);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read source file " + file, e);
        }
    }

    private static byte[] readArchive(Path archive) {
        try {
            return Files.readAllBytes(archive);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read source package " + archive, e);
        }
    }
}
