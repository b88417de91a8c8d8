package com.example.mediaindexer.domain.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MediaFingerprint {

    Long deviceId;

    Long inode;

    long size;

    long mtime;

    String weakHash;

    /**
     * Stable text form used for change detection. Device and inode are included only when both
     * are known.
     */
    public String hashRepr() {
        StringBuilder sb = new StringBuilder();
        if (deviceId != null && inode != null) {
            sb.append(deviceId).append(':').append(inode).append(':');
        }
        sb.append(size).append(':').append(mtime);
        if (weakHash != null) {
            sb.append(':').append(weakHash);
        }
        return sb.toString();
    }
}
