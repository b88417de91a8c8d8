package com.example.mediaindexer.domain.model;

import lombok.Value;

@Value
public class LibraryRoot {

    Long id;

    String path;
}
