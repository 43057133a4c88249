package com.csd.packagefinder.registry;

import com.csd.packagefinder.exception.RegistryException;
import com.csd.packagefinder.model.PackageInfo;
import com.csd.packagefinder.model.RegistryId;
import okhttp3.HttpUrl;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * CRAN package pages. The current release comes from the package page, older releases from
 * the source archive listing.
 */
public class CranSource extends AbstractRegistrySource {

    static final String DEFAULT_BASE = "https://cran.r-project.org";

    private final HttpUrl base;

    public CranSource(RegistryHttpClient http) {
        this(http, DEFAULT_BASE);
    }

    public CranSource(RegistryHttpClient http, String base) {
        super(RegistryId.CRAN, http);
        this.base = baseUrl(base);
    }

    @Override
    protected List<PackageInfo> lookup(String packageName) throws RegistryException {
        String registryName = packageName;
        Optional<String> page = http.getText(packagePage(packageName));
        if (page.isEmpty()) {
            // CRAN names are case sensitive
            Optional<String> corrected = correctCase(packageName);
            if (corrected.isEmpty()) {
                return List.of();
            }
            registryName = corrected.get();
            page = http.getText(packagePage(registryName));
            if (page.isEmpty()) {
                return List.of();
            }
        }

        Document doc = Jsoup.parse(page.get(), packagePage(registryName).toString());
        List<String> versions = archivedVersions(registryName);
        String current = field(doc, "Version");
        if (current != null) {
            versions.add(current);
        }

        return listOf(draft(packageName)
                .registryName(registryName)
                .url(packagePage(registryName).toString())
                .description(description(doc))
                .versions(versions)
                .license(field(doc, "License"))
                .build());
    }

    HttpUrl packagePage(String name) {
        return base.newBuilder()
                .addPathSegment("web").addPathSegment("packages")
                .addPathSegment(name).addPathSegment("index.html")
                .build();
    }

    private Optional<String> correctCase(String packageName) throws RegistryException {
        HttpUrl url = base.newBuilder()
                .addPathSegment("web").addPathSegment("packages")
                .addPathSegment("available_packages_by_name.html")
                .build();
        Optional<String> listing = http.getText(url);
        if (listing.isEmpty()) {
            return Optional.empty();
        }
        List<String> names = Jsoup.parse(listing.get()).select("td a[href]").stream()
                .map(Element::text)
                .collect(Collectors.toList());
        return matchIgnoringCase(packageName, names);
    }

    private List<String> archivedVersions(String name) throws RegistryException {
        HttpUrl url = base.newBuilder()
                .addPathSegment("src").addPathSegment("contrib").addPathSegment("Archive")
                .addPathSegment(name).addPathSegment("")
                .build();
        List<String> versions = new ArrayList<>();
        Optional<String> listing = http.getText(url);
        if (listing.isEmpty()) {
            return versions;
        }
        Pattern tarball = Pattern.compile("^" + Pattern.quote(name) + "_(.+)\\.tar\\.gz$");
        for (Element link : Jsoup.parse(listing.get()).select("a[href]")) {
            Matcher m = tarball.matcher(link.attr("href"));
            if (m.matches()) {
                versions.add(m.group(1));
            }
        }
        return versions;
    }

    /** Value cell of a "Field:" row in the package table. */
    static String field(Document doc, String label) {
        for (Element row : doc.select("table tr")) {
            Element first = row.selectFirst("td");
            if (first != null && first.text().trim().equals(label + ":")) {
                Element value = first.nextElementSibling();
                return value == null ? null : value.text().trim();
            }
        }
        return null;
    }

    /** Title from the heading, followed by the first paragraph. */
    static String description(Document doc) {
        Element heading = doc.selectFirst("h2");
        Element paragraph = doc.selectFirst("h2 ~ p");
        String title = heading == null ? "" : heading.text();
        int colon = title.indexOf(':');
        if (colon >= 0) {
            title = title.substring(colon + 1).trim();
        }
        String body = paragraph == null ? "" : paragraph.text();
        if (title.isEmpty()) return body;
        return body.isEmpty() ? title : title + "\n" + body;
    }
}
