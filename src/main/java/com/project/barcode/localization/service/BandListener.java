package com.project.barcode.localization.service;

import com.project.barcode.localization.DTOs.BandScores;

/** Notified once per band, in scan order, after the band's regions are known. */
@FunctionalInterface
public interface BandListener {

    BandListener NONE = (grid, band) -> { };

    void onBand(TileGrid grid, BandScores band);
}
