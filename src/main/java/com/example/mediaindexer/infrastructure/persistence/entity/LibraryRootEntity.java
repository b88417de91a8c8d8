package com.example.mediaindexer.infrastructure.persistence.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LibraryRootEntity {

    private Long id;

    private Long libraryId;

    private String path;

    private Integer enabled;
}
