package com.stockpipe.jp.recommend;

import java.time.LocalDate;
import java.util.List;

public record MergeJobResult(
        LocalDate referenceDate,
        int total,
        int refined,
        int overrides,
        List<String> layersFound,
        boolean written
) {
    public MergeJobResult {
        layersFound = layersFound == null ? List.of() : List.copyOf(layersFound);
    }
}
