package com.example.slidecast_backend.dto.pipeline;

import com.example.slidecast_backend.util.CompositionMode;

public record SlideComposition(int slideNumber, CompositionMode mode) {
}
