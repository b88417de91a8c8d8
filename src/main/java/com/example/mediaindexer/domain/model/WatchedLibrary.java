package com.example.mediaindexer.domain.model;

import com.example.mediaindexer.domain.enumtype.LibraryType;
import java.util.List;
import lombok.Value;

@Value
public class WatchedLibrary {

    Long id;

    String name;

    LibraryType libraryType;

    List<LibraryRoot> roots;

    public LibraryRoot findRoot(Long rootId) {
        if (roots == null || rootId == null) {
            return null;
        }
        for (LibraryRoot root : roots) {
            if (rootId.equals(root.getId())) {
                return root;
            }
        }
        return null;
    }
}
