package com.example.mediaindexer.infrastructure.persistence.entity;

import java.time.LocalDateTime;
import lombok.Data;

@Data
public class LibraryEntity {

    private Long id;

    private String name;

    private String libraryType;

    private Integer enabled;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
