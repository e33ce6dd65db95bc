package io.meshview.remote;

import io.meshview.model.Device;
import io.meshview.model.RemoteDetails;
import io.meshview.model.Snapshot;
import io.meshview.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class RemoteApiClient {
    private static final Logger log = LoggerFactory.getLogger(RemoteApiClient.class);

    private final HttpClient http;
    private final String baseUrl;
    private final String tailnet;
    private final String apiKey;
    private final Duration checkTimeout;
    private final Duration requestTimeout;

    public RemoteApiClient(String baseUrl, String tailnet, String apiKey, Duration checkTimeout, Duration requestTimeout) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("remote API base URL cannot be empty");
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.tailnet = tailnet == null || tailnet.isBlank() ? "-" : tailnet.trim();
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.checkTimeout = checkTimeout;
        this.requestTimeout = requestTimeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(checkTimeout)
                .build();
    }

    public boolean configured() {
        return !apiKey.isBlank();
    }

    public void checkReachable() throws RemoteApiException {
        get(devicesUri(), checkTimeout);
    }

    public List<RemoteDevice> listDevices() throws RemoteApiException {
        String body = get(devicesUri(), requestTimeout);
        RemoteDevice.Listing listing;
        try {
            listing = Jsons.strictMapper().readValue(body, RemoteDevice.Listing.class);
        } catch (IOException e) {
            throw new RemoteApiException(RemoteApiException.Kind.UNAVAILABLE, "unreadable device listing: " + e.getMessage(), e);
        }
        if (listing == null || listing.devices() == null) {
            throw new RemoteApiException(RemoteApiException.Kind.UNAVAILABLE, "device listing has no devices field");
        }
        for (RemoteDevice device : listing.devices()) {
            if (device == null) {
                throw new RemoteApiException(RemoteApiException.Kind.UNAVAILABLE, "device listing has a null entry");
            }
            if (device.tags() != null && device.tags().contains(null)) {
                throw new RemoteApiException(RemoteApiException.Kind.UNAVAILABLE, "device " + device.id() + " has a null tag");
            }
            parseExpiry(device);
        }
        return listing.devices();
    }

    public Snapshot augment(Snapshot local) {
        if (!configured()) {
            return local;
        }
        List<RemoteDevice> remote;
        try {
            remote = listDevices();
        } catch (RemoteApiException e) {
            log.warn("Remote augmentation skipped ({}): {}", e.kind(), e.getMessage());
            return local;
        }
        Map<String, RemoteDevice> byKey = index(remote);
        Device self = merge(local.self().device(), byKey);
        Map<String, Device> peers = new LinkedHashMap<>();
        int matched = self.remote() == null ? 0 : 1;
        for (Device peer : local.peers().values()) {
            Device merged = merge(peer, byKey);
            if (merged.remote() != null) {
                matched++;
            }
            peers.put(merged.id(), merged);
        }
        log.debug("Remote augmentation matched {} of {} devices", matched, local.peers().size() + 1);
        return local.withAugmentation(local.self().withDevice(self), peers);
    }

    private URI devicesUri() {
        return URI.create(baseUrl + "/tailnet/" + URLEncoder.encode(tailnet, StandardCharsets.UTF_8) + "/devices");
    }

    private String get(URI uri, Duration timeout) throws RemoteApiException {
        if (!configured()) {
            throw new RemoteApiException(RemoteApiException.Kind.UNAUTHORIZED, "no API key configured");
        }
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json")
                .GET()
                .build();
        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new RemoteApiException(RemoteApiException.Kind.UNAVAILABLE, "request to " + uri + " failed: " + e, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteApiException(RemoteApiException.Kind.UNAVAILABLE, "request to " + uri + " interrupted", e);
        }
        int status = response.statusCode();
        if (status == 401 || status == 403) {
            throw new RemoteApiException(RemoteApiException.Kind.UNAUTHORIZED, "API rejected credential status=" + status);
        }
        if (status / 100 != 2) {
            throw new RemoteApiException(RemoteApiException.Kind.UNAVAILABLE, "API error status=" + status);
        }
        return response.body();
    }

    private static Map<String, RemoteDevice> index(List<RemoteDevice> devices) {
        Map<String, RemoteDevice> out = new HashMap<>();
        for (RemoteDevice device : devices) {
            if (device.addresses() != null) {
                for (String address : device.addresses()) {
                    out.putIfAbsent("addr:" + address, device);
                }
            }
            if (device.id() != null) {
                out.put("id:" + device.id(), device);
            }
            if (device.nodeId() != null) {
                out.put("id:" + device.nodeId(), device);
            }
        }
        return out;
    }

    private static Device merge(Device local, Map<String, RemoteDevice> byKey) {
        RemoteDevice match = byKey.get("id:" + local.id());
        if (match == null && local.primaryAddress() != null) {
            match = byKey.get("addr:" + local.primaryAddress());
        }
        if (match == null) {
            return local;
        }
        RemoteDetails details = new RemoteDetails(
                Boolean.TRUE.equals(match.authorized()),
                match.clientVersion(),
                Boolean.TRUE.equals(match.updateAvailable()),
                expiryOrNull(match),
                match.user()
        );
        return local.withRemote(details, match.tags() == null ? Set.of() : Set.copyOf(match.tags()));
    }

    private static void parseExpiry(RemoteDevice device) throws RemoteApiException {
        try {
            expiryOrNull(device);
        } catch (DateTimeParseException e) {
            throw new RemoteApiException(
                    RemoteApiException.Kind.UNAVAILABLE,
                    "device " + device.id() + " has invalid expires: " + device.expires(),
                    e
            );
        }
    }

    private static Instant expiryOrNull(RemoteDevice device) {
        String raw = device.expires();
        if (raw == null || raw.isBlank()) {
            return null;
        }
        Instant parsed = Instant.parse(raw);
        return parsed.equals(Instant.parse("0001-01-01T00:00:00Z")) ? null : parsed;
    }
}
