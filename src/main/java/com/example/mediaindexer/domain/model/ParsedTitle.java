package com.example.mediaindexer.domain.model;

import lombok.Value;

@Value
public class ParsedTitle {

    String title;

    Integer year;

    Integer season;

    Integer episode;

    public boolean isEpisode() {
        return season != null && episode != null;
    }
}
