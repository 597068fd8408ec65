package com.climatewatch.analysis.exception;

import com.climatewatch.common.exception.ClimateException;
import com.climatewatch.common.exception.ErrorKind;

public class NoDatasetException extends ClimateException {

    public NoDatasetException() {
        super("AnalysisService", ErrorKind.NO_DATASET, "No dataset loaded. Upload a CSV dataset first.");
    }
}
