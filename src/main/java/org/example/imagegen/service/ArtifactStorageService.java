package org.example.imagegen.service;

import org.example.imagegen.config.GenerationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Places finished generations under the storage root:
 * {@code generations/{user}/{yyyy}/{MM}/{dd}/gen_{job}_{file}} for originals and
 * {@code thumbnails/{user}/{yyyy}/{MM}/{dd}/{stem}_{w}x{h}.png} for thumbnails.
 * Returned paths are relative to the root and always use forward slashes.
 */
@Service
public class ArtifactStorageService {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStorageService.class);
    private static final int MAX_SEGMENT_LENGTH = 80;

    private final Path root;
    private final List<Integer> thumbnailSizes;
    private final int primaryThumbnailSize;
    private final Clock clock;

    @Autowired
    public ArtifactStorageService(GenerationProperties properties) {
        this(Paths.get(properties.getStorage().getRoot()),
                properties.getStorage().getThumbnailSizes(),
                properties.getStorage().getPrimaryThumbnailSize(),
                Clock.systemDefaultZone());
    }

    ArtifactStorageService(Path root, List<Integer> thumbnailSizes, int primaryThumbnailSize, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.thumbnailSizes = thumbnailSizes.stream().filter(size -> size != null && size > 0).toList();
        this.primaryThumbnailSize = primaryThumbnailSize;
        this.clock = clock;
    }

    /**
     * Write the images and their thumbnails. On failure everything written so
     * far is removed again before the exception propagates.
     */
    public StoredArtifacts store(String userId, String jobId, List<DownloadedImage> images) {
        if (images == null || images.isEmpty()) {
            throw new ArtifactStorageException("Generation for job " + jobId + " produced no images");
        }
        String datePath = datePath(LocalDate.now(clock));
        String userSegment = normalizeSegment(userId, "anonymous");
        String jobSegment = normalizeSegment(jobId, "job");
        String generationDir = "generations/" + userSegment + "/" + datePath;
        String thumbnailDir = "thumbnails/" + userSegment + "/" + datePath;

        List<String> outputPaths = new ArrayList<>();
        List<String> thumbnailPaths = new ArrayList<>();
        String primaryThumbnail = null;
        try {
            for (DownloadedImage image : images) {
                String baseName = "gen_" + jobSegment + "_" + safeFilename(image.filename());
                String outputPath = generationDir + "/" + baseName;
                write(outputPath, image.bytes());
                outputPaths.add(outputPath);

                BufferedImage source = decode(image);
                String stem = stripExtension(baseName);
                for (int size : thumbnailSizes) {
                    BufferedImage thumbnail = scaleToFit(source, size);
                    String thumbnailPath = thumbnailDir + "/" + stem + "_"
                            + thumbnail.getWidth() + "x" + thumbnail.getHeight() + ".png";
                    // small sources are never upscaled, so sizes can collapse
                    if (!thumbnailPaths.contains(thumbnailPath)) {
                        writeImage(thumbnailPath, thumbnail);
                        thumbnailPaths.add(thumbnailPath);
                    }
                    if (primaryThumbnail == null && size == primaryThumbnailSize) {
                        primaryThumbnail = thumbnailPath;
                    }
                }
            }
        } catch (IOException | RuntimeException e) {
            deleteQuietly(outputPaths);
            deleteQuietly(thumbnailPaths);
            if (e instanceof ArtifactStorageException storageException) {
                throw storageException;
            }
            throw new ArtifactStorageException("Failed to store artifacts for job " + jobId + ": " + e.getMessage(), e);
        }

        if (primaryThumbnail == null && !thumbnailPaths.isEmpty()) {
            primaryThumbnail = thumbnailPaths.get(0);
        }
        log.info("Stored {} image(s) and {} thumbnail(s) for job {}", outputPaths.size(), thumbnailPaths.size(), jobId);
        return new StoredArtifacts(outputPaths, thumbnailPaths, primaryThumbnail);
    }

    /**
     * Best-effort removal, used when a job was cancelled after its files were
     * written.
     */
    public void delete(StoredArtifacts artifacts) {
        if (artifacts == null) {
            return;
        }
        deleteQuietly(artifacts.outputPaths());
        deleteQuietly(artifacts.thumbnailPaths());
    }

    public Path resolve(String relativePath) {
        Path resolved = root.resolve(relativePath).normalize();
        if (!resolved.startsWith(root)) {
            throw new ArtifactStorageException("Path escapes storage root: " + relativePath);
        }
        return resolved;
    }

    public Path getRoot() {
        return root;
    }

    static String datePath(LocalDate date) {
        return String.format("%04d/%02d/%02d", date.getYear(), date.getMonthValue(), date.getDayOfMonth());
    }

    static String normalizeSegment(String value, String fallback) {
        if (value == null) {
            return fallback;
        }
        String normalized = value.trim().toLowerCase();
        normalized = normalized.replaceAll("[^a-z0-9]+", "-");
        normalized = normalized.replaceAll("^-+", "").replaceAll("-+$", "");
        if (normalized.length() > MAX_SEGMENT_LENGTH) {
            normalized = normalized.substring(0, MAX_SEGMENT_LENGTH);
            normalized = normalized.replaceAll("-+$", "");
        }
        return normalized.isBlank() ? fallback : normalized;
    }

    private static String safeFilename(String filename) {
        String name = filename == null ? "" : Paths.get(filename).getFileName().toString();
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return name.isBlank() ? "image.png" : name;
    }

    private static String stripExtension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    private void write(String relativePath, byte[] bytes) throws IOException {
        Path target = resolve(relativePath);
        Files.createDirectories(target.getParent());
        Files.write(target, bytes);
    }

    private void writeImage(String relativePath, BufferedImage image) throws IOException {
        Path target = resolve(relativePath);
        Files.createDirectories(target.getParent());
        if (!ImageIO.write(image, "png", target.toFile())) {
            throw new ArtifactStorageException("No PNG writer available for " + relativePath);
        }
    }

    private static BufferedImage decode(DownloadedImage image) throws IOException {
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(image.bytes()));
        if (decoded == null) {
            throw new ArtifactStorageException("Generated file " + image.filename() + " is not a readable image");
        }
        return decoded;
    }

    static BufferedImage scaleToFit(BufferedImage source, int maxSize) {
        double scale = Math.min(1.0, Math.min(
                (double) maxSize / source.getWidth(),
                (double) maxSize / source.getHeight()));
        int width = Math.max(1, (int) Math.round(source.getWidth() * scale));
        int height = Math.max(1, (int) Math.round(source.getHeight() * scale));
        BufferedImage scaled = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D graphics = scaled.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            graphics.drawImage(source, 0, 0, width, height, null);
        } finally {
            graphics.dispose();
        }
        return scaled;
    }

    private void deleteQuietly(List<String> relativePaths) {
        for (String relativePath : relativePaths) {
            try {
                Files.deleteIfExists(resolve(relativePath));
            } catch (IOException | ArtifactStorageException e) {
                log.warn("Failed to delete artifact {}: {}", relativePath, e.getMessage());
            }
        }
    }

    public record DownloadedImage(String filename, byte[] bytes) {
    }

    public record StoredArtifacts(List<String> outputPaths, List<String> thumbnailPaths, String primaryThumbnail) {

        public StoredArtifacts {
            outputPaths = List.copyOf(outputPaths);
            thumbnailPaths = List.copyOf(thumbnailPaths);
        }

        public String primaryOutput() {
            return outputPaths.isEmpty() ? null : outputPaths.get(0);
        }
    }
}
