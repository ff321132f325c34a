package org.example.imagegen.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactStorageServiceTest {

    @TempDir
    Path root;

    private ArtifactStorageService storage;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneId.of("UTC"));
        storage = new ArtifactStorageService(root, List.of(150, 300, 600), 300, clock);
    }

    @Test
    void store_organizesOriginalsAndThumbnailsByUserAndDate() throws IOException {
        ArtifactStorageService.StoredArtifacts stored = storage.store("user-1", "job-1", List.of(
                new ArtifactStorageService.DownloadedImage("gen_job1_00001_.png", png(512, 512))));

        assertEquals(List.of("generations/user-1/2026/03/01/gen_job-1_gen_job1_00001_.png"), stored.outputPaths());
        assertEquals(List.of(
                "thumbnails/user-1/2026/03/01/gen_job-1_gen_job1_00001__150x150.png",
                "thumbnails/user-1/2026/03/01/gen_job-1_gen_job1_00001__300x300.png",
                "thumbnails/user-1/2026/03/01/gen_job-1_gen_job1_00001__512x512.png"
        ), stored.thumbnailPaths());
        assertEquals("thumbnails/user-1/2026/03/01/gen_job-1_gen_job1_00001__300x300.png", stored.primaryThumbnail());
        assertEquals(stored.outputPaths().get(0), stored.primaryOutput());
        for (String path : stored.outputPaths()) {
            assertTrue(Files.exists(root.resolve(path)));
        }
        BufferedImage thumbnail = ImageIO.read(root.resolve(stored.primaryThumbnail()).toFile());
        assertEquals(300, thumbnail.getWidth());
    }

    @Test
    void store_neverUpscalesSmallImages() throws IOException {
        ArtifactStorageService.StoredArtifacts stored = storage.store("user-1", "job-2", List.of(
                new ArtifactStorageService.DownloadedImage("small.png", png(100, 80))));

        assertEquals(List.of("thumbnails/user-1/2026/03/01/gen_job-2_small_100x80.png"), stored.thumbnailPaths());
        assertEquals(stored.thumbnailPaths().get(0), stored.primaryThumbnail());
    }

    @Test
    void store_whenImageIsUnreadable_removesPartialOutput() throws IOException {
        ArtifactStorageService.StoredArtifacts first = storage.store("user-1", "job-3", List.of(
                new ArtifactStorageService.DownloadedImage("ok.png", png(64, 64))));
        storage.delete(first);

        assertThrows(ArtifactStorageException.class, () -> storage.store("user-1", "job-3", List.of(
                new ArtifactStorageService.DownloadedImage("ok.png", png(64, 64)),
                new ArtifactStorageService.DownloadedImage("broken.png", new byte[]{1, 2, 3}))));

        assertFalse(Files.exists(root.resolve("generations/user-1/2026/03/01/gen_job-3_ok.png")));
        assertFalse(Files.exists(root.resolve("generations/user-1/2026/03/01/gen_job-3_broken.png")));
        assertFalse(Files.exists(root.resolve("thumbnails/user-1/2026/03/01/gen_job-3_ok_64x64.png")));
    }

    @Test
    void store_withoutImages_fails() {
        assertThrows(ArtifactStorageException.class, () -> storage.store("user-1", "job-4", List.of()));
    }

    @Test
    void resolve_rejectsPathsOutsideRoot() {
        assertThrows(ArtifactStorageException.class, () -> storage.resolve("../outside.png"));
    }

    @Test
    void normalizeSegment_andDatePath() {
        assertEquals("alice-smith", ArtifactStorageService.normalizeSegment("  Alice Smith ", "anonymous"));
        assertEquals("anonymous", ArtifactStorageService.normalizeSegment("///", "anonymous"));
        assertEquals("2026/12/05", ArtifactStorageService.datePath(LocalDate.of(2026, 12, 5)));
    }

    private static byte[] png(int width, int height) throws IOException {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(image, "png", out);
        return out.toByteArray();
    }
}
