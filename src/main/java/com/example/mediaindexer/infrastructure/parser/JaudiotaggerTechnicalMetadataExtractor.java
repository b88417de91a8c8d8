package com.example.mediaindexer.infrastructure.parser;

import com.example.mediaindexer.domain.model.TechnicalMetadata;
import java.io.File;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jaudiotagger.audio.AudioFile;
import org.jaudiotagger.audio.AudioFileIO;
import org.jaudiotagger.audio.AudioHeader;
import org.jaudiotagger.tag.FieldKey;
import org.jaudiotagger.tag.Tag;
import org.springframework.stereotype.Component;

@Component
public class JaudiotaggerTechnicalMetadataExtractor implements TechnicalMetadataExtractor {

    private static final Pattern FIRST_INTEGER_PATTERN = Pattern.compile("(\\d+)");

    @Override
    public TechnicalMetadata extract(File mediaFile) throws Exception {
        AudioFile parsed = AudioFileIO.read(mediaFile);
        AudioHeader header = parsed.getAudioHeader();
        Tag tag = parsed.getTag();

        TechnicalMetadata metadata = new TechnicalMetadata();
        if (header != null) {
            metadata.setContainer(trimToNull(header.getFormat()));
            metadata.setCodec(trimToNull(header.getEncodingType()));
            metadata.setDurationSec(header.getTrackLength());
            metadata.setBitrate(parseInteger(header.getBitRate()));
            metadata.setSampleRate(parseInteger(header.getSampleRate()));
            metadata.setChannels(parseInteger(header.getChannels()));
            Integer bitsPerSample = header.getBitsPerSample();
            metadata.setBitsPerSample(bitsPerSample != null && bitsPerSample > 0 ? bitsPerSample : null);
            metadata.setLossless(header.isLossless());
        }
        metadata.setEmbeddedTitle(safeTagValue(tag, FieldKey.TITLE));
        metadata.setEmbeddedYear(parseInteger(safeTagValue(tag, FieldKey.YEAR)));
        return metadata;
    }

    private String safeTagValue(Tag tag, FieldKey fieldKey) {
        if (tag == null) {
            return null;
        }
        return trimToNull(tag.getFirst(fieldKey));
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private Integer parseInteger(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        Matcher matcher = FIRST_INTEGER_PATTERN.matcher(raw);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.parseInt(matcher.group(1));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
