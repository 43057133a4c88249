package com.csd.packagefinder.service;

import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryOutcome;
import com.csd.packagefinder.model.RegistrySearchError;
import com.csd.packagefinder.model.SearchResult;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges the outcomes of every registry for one package name.
 * Records keep the order of the outcomes given (the configured registry order); errors are
 * kept alongside, so a failed registry never hides another registry's records.
 */
public final class ResultAggregator {

    private ResultAggregator() {}

    public static SearchResult aggregate(List<RegistryOutcome> outcomes) {
        List<PackageInfo> infos = new ArrayList<>();
        List<RegistrySearchError> errors = new ArrayList<>();
        for (RegistryOutcome outcome : outcomes) {
            infos.addAll(outcome.getInfos());
            outcome.getError().ifPresent(errors::add);
        }
        return new SearchResult(List.copyOf(infos), List.copyOf(errors));
    }
}
