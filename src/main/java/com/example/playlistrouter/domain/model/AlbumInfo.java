package com.example.playlistrouter.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AlbumInfo {

    private String id;
    private String name;
    /** yyyy, yyyy-MM or yyyy-MM-dd depending on the album's release date precision. */
    private String releaseDate;
    private String uri;
}
