package com.example.slidecast_backend.engine.Interfaces;

import java.nio.file.Path;
import java.util.List;

public interface SlideExtractor extends NamedProvider {
    /** Returns the text of each slide in document order. */
    List<String> extract(Path sourceFile) throws Exception;
}
