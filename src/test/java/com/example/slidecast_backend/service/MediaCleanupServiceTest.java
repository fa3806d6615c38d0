package com.example.slidecast_backend.service;

import com.example.slidecast_backend.config.PipelineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class MediaCleanupServiceTest {

    @TempDir
    Path baseDir;

    private LocalStorageService storage;
    private PipelineProperties properties;

    @BeforeEach
    void setUp() {
        storage = new LocalStorageService(baseDir, "raw", "out");
        properties = new PipelineProperties();
    }

    @Test
    void removesWorkTreeButKeepsFinalArtifacts() {
        storage.writeOut("uploads/u1/work/audio/slide_1.mp3", new byte[]{1});
        storage.writeOut("uploads/u1/work/images/slide_1.png", new byte[]{1});
        storage.writeOut("uploads/u1/presentation.mp4", new byte[]{1});

        int deleted = new MediaCleanupService(storage, properties).cleanupIntermediates("u1");

        assertThat(deleted).isEqualTo(5);
        assertThat(Files.exists(storage.resolveOut("uploads/u1/work"))).isFalse();
        assertThat(storage.existsInOut("uploads/u1/presentation.mp4")).isTrue();
    }

    @Test
    void removesEmptyParentsUpToTheOutputRoot() {
        storage.writeOut("uploads/u2/work/audio/slide_1.mp3", new byte[]{1});

        new MediaCleanupService(storage, properties).cleanupIntermediates("u2");

        assertThat(Files.exists(storage.resolveOut("uploads"))).isFalse();
        assertThat(Files.isDirectory(storage.rootOut())).isTrue();
    }

    @Test
    void doesNothingWhenDisabledOrAbsent() {
        storage.writeOut("uploads/u3/work/audio/slide_1.mp3", new byte[]{1});
        properties.setDeleteIntermediatesOnSuccess(false);

        assertThat(new MediaCleanupService(storage, properties).cleanupIntermediates("u3")).isZero();
        assertThat(storage.existsInOut("uploads/u3/work/audio/slide_1.mp3")).isTrue();

        properties.setDeleteIntermediatesOnSuccess(true);
        assertThat(new MediaCleanupService(storage, properties).cleanupIntermediates("missing")).isZero();
    }

    @Test
    void uploadIdReachingIntoAnotherUploadIsRejected() {
        storage.writeOut("uploads/victim/work/audio/slide_1.mp3", new byte[]{1});

        int deleted = new MediaCleanupService(storage, properties).cleanupIntermediates("x/../victim");

        assertThat(deleted).isZero();
        assertThat(storage.existsInOut("uploads/victim/work/audio/slide_1.mp3")).isTrue();
    }
}
