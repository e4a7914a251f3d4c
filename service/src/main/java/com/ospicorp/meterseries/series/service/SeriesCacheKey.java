package com.ospicorp.meterseries.series.service;

import com.ospicorp.meterseries.series.model.SeriesWindow;
import com.ospicorp.meterseries.series.model.enums.Frequency;

public record SeriesCacheKey(String meterId, SeriesWindow window, Frequency frequency) {}
