package com.example.mediaindexer.domain.model;

import lombok.Data;

@Data
public class TechnicalMetadata {

    private String container;

    private String codec;

    private Integer durationSec;

    private Integer bitrate;

    private Integer sampleRate;

    private Integer channels;

    private Integer bitsPerSample;

    private Boolean lossless;

    private String embeddedTitle;

    private Integer embeddedYear;
}
