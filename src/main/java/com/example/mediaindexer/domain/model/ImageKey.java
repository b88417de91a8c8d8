package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.MediaType;
import lombok.Value;

@Value
public class ImageKey {

    MediaType mediaType;

    String mediaId;

    String imageType;

    int orderIndex;

    String variant;
}
