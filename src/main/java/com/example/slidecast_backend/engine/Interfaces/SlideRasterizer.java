package com.example.slidecast_backend.engine.Interfaces;

import java.nio.file.Path;
import java.util.List;

public interface SlideRasterizer extends NamedProvider {
    /**
     * Renders every slide to an image in the out area.
     *
     * @param keyPrefix out-area prefix for the images.
     * @return object keys, one per slide in order.
     */
    List<String> rasterize(Path sourceFile, int slideCount, String keyPrefix) throws Exception;
}
