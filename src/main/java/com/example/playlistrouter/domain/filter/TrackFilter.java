package com.example.playlistrouter.domain.filter;

import com.example.playlistrouter.domain.model.TrackInfo;

public interface TrackFilter {

    boolean matches(TrackInfo track);
}
