package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import okhttp3.HttpUrl;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * BioLib application pages. BioLib has no public catalog API, so the app page is scraped:
 * title, meta description and any version labels shown on the page.
 */
public class BioLibSource extends AbstractRegistrySource {

    static final String DEFAULT_BASE = "https://biolib.com";
    static final List<String> ACCOUNTS = List.of("bio-utils", "biolib");

    private static final Pattern VERSION = Pattern.compile("\\bv?(\\d+\\.\\d+(?:\\.\\d+)*)\\b");

    private final HttpUrl base;

    public BioLibSource(RegistryHttpClient http) {
        this(http, DEFAULT_BASE);
    }

    public BioLibSource(RegistryHttpClient http, String base) {
        super(RegistryId.BIOLIB, http);
        this.base = baseUrl(base);
    }

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        String slug = packageName.toLowerCase(Locale.ROOT);
        for (String account : ACCOUNTS) {
            HttpUrl url = base.newBuilder().addPathSegment(account).addPathSegment(slug).addPathSegment("").build();
            Optional<String> page = http.getText(url);
            if (page.isPresent()) {
                return parse(packageName, url, Jsoup.parse(page.get(), url.toString()));
            }
        }
        return List.of();
    }

    private List<PackageInfo> parse(String packageName, HttpUrl url, Document doc) {
        Element heading = doc.selectFirst("h1");
        String title = heading != null ? heading.text() : doc.title();
        if (title.contains(":")) {
            title = title.substring(0, title.indexOf(':')).trim();
        }
        Element meta = doc.selectFirst("meta[name=description]");
        String description = meta != null ? meta.attr("content") : "";
        if (description.isBlank()) {
            Element block = doc.selectFirst(".description, .app-description");
            description = block == null ? "" : block.text();
        }

        return listOf(draft(packageName)
                .registryName(title.isBlank() ? packageName : title)
                .url(url.toString())
                .description(description)
                .readme(doc.select("article, .readme").text())
                .versions(versions(doc))
                .build());
    }

    /** Version labels from elements whose class mentions "version". */
    static List<String> versions(Document doc) {
        Set<String> found = new LinkedHashSet<>();
        for (Element el : doc.select("[class*=version]")) {
            Matcher m = VERSION.matcher(el.ownText());
            while (m.find()) {
                found.add(m.group(1));
            }
        }
        return new ArrayList<>(found);
    }
}
