package com.example.slidecast_backend.service;

import com.example.slidecast_backend.dto.pipeline.ScriptEntry;
import com.example.slidecast_backend.dto.pipeline.ScriptSet;
import com.example.slidecast_backend.dto.pipeline.SlideFile;
import com.example.slidecast_backend.dto.pipeline.SlideFiles;
import com.example.slidecast_backend.dto.pipeline.SubtitleFiles;
import com.example.slidecast_backend.exception.StorageException;
import com.example.slidecast_backend.service.Interfaces.StorageService;
import com.example.slidecast_backend.service.Interfaces.SubtitleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Builds SRT and VTT subtitles from narration scripts. Each slide occupies its own time window; inside a
 * slide the sentences share the window in proportion to their length.
 */
@Service
public class SubtitleServiceImpl implements SubtitleService {
    private static final Logger LOGGER = LoggerFactory.getLogger(SubtitleServiceImpl.class);
    private static final long MIN_CUE_DURATION_MS = 500L;
    private static final int MAX_LINE_CHARS = 38;
    private static final Pattern SENTENCE_END = Pattern.compile("(?<=[.!?。！？])\\s*");
    private static final Pattern CJK = Pattern.compile("[\\u3040-\\u30FF\\u3400-\\u4DBF\\u4E00-\\u9FFF\\uF900-\\uFAFF\\uAC00-\\uD7AF\\u0E00-\\u0E7F]");
    private static final Set<String> CHAR_WEIGHTED_LANGUAGES = Set.of(
            "simplified_chinese", "traditional_chinese", "japanese", "korean", "thai");

    private final StorageService storageService;

    public SubtitleServiceImpl(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public SubtitleFiles writeSubtitles(String keyPrefix, ScriptSet scripts, SlideFiles timing) {
        List<Cue> cues = buildCues(scripts, timing);
        if (cues.isEmpty()) {
            LOGGER.debug("No subtitle cues for language={} - writing empty files", scripts.language());
        }

        String baseName = keyPrefix + "subtitles_" + scripts.language();
        Path srtTmp = null;
        Path vttTmp = null;
        try {
            srtTmp = Files.createTempFile("slidecast-", ".srt");
            vttTmp = Files.createTempFile("slidecast-", ".vtt");

            Files.writeString(srtTmp, buildSrt(cues), StandardCharsets.UTF_8);
            Files.writeString(vttTmp, buildVtt(cues), StandardCharsets.UTF_8);

            String srtKey = baseName + ".srt";
            String vttKey = baseName + ".vtt";

            storageService.uploadToOut(srtTmp, srtKey);
            storageService.uploadToOut(vttTmp, vttKey);

            return new SubtitleFiles(scripts.language(), srtKey, Files.size(srtTmp), vttKey, Files.size(vttTmp));
        } catch (IOException e) {
            throw new StorageException("Failed to build subtitles", e);
        } finally {
            deleteIfExists(srtTmp);
            deleteIfExists(vttTmp);
        }
    }

    static List<Cue> buildCues(ScriptSet scripts, SlideFiles timing) {
        List<Cue> cues = new ArrayList<>();
        List<SlideFile> slides = timing.files().stream()
                .sorted(Comparator.comparingInt(SlideFile::slideNumber))
                .toList();
        long slideStart = 0;
        for (SlideFile slide : slides) {
            long duration = slide.durationMs() == null ? 0 : slide.durationMs();
            String script = scripts.forSlide(slide.slideNumber()).map(ScriptEntry::script).orElse("");
            List<String> sentences = splitSentences(script);
            long slideEnd = slideStart + duration;
            if (!sentences.isEmpty() && duration > 0 && duration < sentences.size() * MIN_CUE_DURATION_MS) {
                cues.add(new Cue(slideStart, slideEnd, String.join(" ", sentences)));
            } else if (!sentences.isEmpty() && duration > 0) {
                boolean byChars = useCharWeight(script, scripts.language());
                long[] weights = sentences.stream().mapToLong(s -> weight(s, byChars)).toArray();
                long total = 0;
                for (long w : weights) {
                    total += w;
                }
                long cursor = slideStart;
                for (int i = 0; i < sentences.size(); i++) {
                    long end = slideEnd;
                    if (i < sentences.size() - 1) {
                        // leave the minimum cue length for every remaining sentence of this slide
                        long latest = slideEnd - (sentences.size() - 1 - i) * MIN_CUE_DURATION_MS;
                        end = Math.min(Math.max(cursor + duration * weights[i] / total, cursor + MIN_CUE_DURATION_MS), latest);
                    }
                    cues.add(new Cue(cursor, end, sentences.get(i)));
                    cursor = end;
                }
            }
            slideStart = slideEnd;
        }
        return cues;
    }

    private static List<String> splitSentences(String script) {
        if (script == null || script.isBlank()) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (String part : SENTENCE_END.split(script.trim())) {
            String s = part.trim();
            if (!s.isEmpty()) {
                out.add(s);
            }
        }
        return out;
    }

    private static boolean useCharWeight(String text, String language) {
        return CJK.matcher(text).find() || (language != null && CHAR_WEIGHTED_LANGUAGES.contains(language));
    }

    private static long weight(String sentence, boolean byChars) {
        if (byChars) {
            return Math.max(1, sentence.replaceAll("\\s+", "").length());
        }
        return Math.max(1, sentence.split("\\s+").length);
    }

    private static String buildSrt(List<Cue> cues) {
        StringBuilder srt = new StringBuilder();
        for (int i = 0; i < cues.size(); i++) {
            Cue cue = cues.get(i);
            srt.append(i + 1).append('\n');
            srt.append(formatSrtTime(cue.start()))
               .append(" --> ")
               .append(formatSrtTime(cue.end()))
               .append('\n');
            srt.append(formatCueText(cue.text())).append("\n\n");
        }
        return srt.toString();
    }

    private static String buildVtt(List<Cue> cues) {
        StringBuilder vtt = new StringBuilder("WEBVTT\n\n");
        for (Cue cue : cues) {
            vtt.append(formatVttTime(cue.start()))
               .append(" --> ")
               .append(formatVttTime(cue.end()))
               .append('\n');
            vtt.append(formatCueText(cue.text())).append("\n\n");
        }
        return vtt.toString();
    }

    /** Wraps long cue text onto two lines at the most balanced word boundary. */
    static String formatCueText(String text) {
        if (text == null) {
            return "";
        }

        String normalized = text.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= MAX_LINE_CHARS) {
            return normalized;
        }

        String[] words = normalized.split(" ");
        if (words.length <= 1) {
            return normalized;
        }

        int bestSplit = 1;
        int bestPenalty = Integer.MAX_VALUE;
        int bestBalance = Integer.MAX_VALUE;
        for (int split = 1; split < words.length; split++) {
            int len1 = String.join(" ", List.of(words).subList(0, split)).length();
            int len2 = normalized.length() - len1 - 1;
            int penalty = Math.max(0, len1 - MAX_LINE_CHARS) + Math.max(0, len2 - MAX_LINE_CHARS);
            int balance = Math.abs(len1 - len2);
            if (penalty < bestPenalty || (penalty == bestPenalty && balance < bestBalance)) {
                bestPenalty = penalty;
                bestBalance = balance;
                bestSplit = split;
            }
        }
        List<String> all = List.of(words);
        return String.join(" ", all.subList(0, bestSplit)) + "\n" + String.join(" ", all.subList(bestSplit, all.size()));
    }

    static String formatSrtTime(long offsetMs) {
        return formatTime(offsetMs, ',');
    }

    static String formatVttTime(long offsetMs) {
        return formatTime(offsetMs, '.');
    }

    private static String formatTime(long offsetMs, char millisSeparator) {
        long safeMs = Math.max(0, offsetMs);
        long hours = safeMs / 3_600_000;
        long minutes = (safeMs % 3_600_000) / 60_000;
        long seconds = (safeMs % 60_000) / 1000;
        long millis = safeMs % 1000;
        return String.format("%02d:%02d:%02d%c%03d", hours, minutes, seconds, millisSeparator, millis);
    }

    private static void deleteIfExists(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            LOGGER.warn("Failed to delete temp subtitle file {}", file, e);
        }
    }

    record Cue(long start, long end, String text) {}
}
