package com.example.slidecast_backend.engine.Interfaces;

public interface SpeechSynthesizer extends NamedProvider {
    /**
     * Synthesizes {@code text} into the out area under {@code objectKey}.
     *
     * @return duration of the written audio in milliseconds.
     */
    long synthesize(String text, String language, String objectKey) throws Exception;
}
