package com.example.slidecast_backend.engine.Interfaces;

import java.nio.file.Path;

public interface VisionAnalyzer extends NamedProvider {
    String analyze(Path image) throws Exception;
}
