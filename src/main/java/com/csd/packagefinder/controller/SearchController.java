package com.csd.packagefinder.controller;

import com.csd.packagefinder.model.RegistryId;
import com.csd.packagefinder.model.SearchResult;
import com.csd.packagefinder.registry.RegistrySource;
import com.csd.packagefinder.service.PackageSearcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Slf4j
@RestController
@RequestMapping("/api")
public class SearchController {

    private final PackageSearcher packageSearcher;

    public SearchController(PackageSearcher packageSearcher) { this.packageSearcher = packageSearcher; }

    /**
     * Searches several names at once: {@code /api/search?name=samtools&name=fastqc}.
     */
    @GetMapping("/search")
    public Map<String, SearchResult> search(@RequestParam(name = "name", required = false) List<String> names) {
        log.info("Search request: names={}", names);
        return packageSearcher.searchPackages(names);
    }

    @GetMapping("/search/{name}")
    public SearchResult searchOne(@PathVariable String name) {
        log.info("Search request: name={}", name);
        return packageSearcher.searchPackage(name);
    }

    @GetMapping("/registries")
    public List<RegistryId> registries() {
        return packageSearcher.registries().stream()
                .map(RegistrySource::id)
                .collect(Collectors.toList());
    }
}
