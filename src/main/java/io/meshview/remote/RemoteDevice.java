package io.meshview.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RemoteDevice(
        String id,
        String nodeId,
        String hostname,
        List<String> addresses,
        String user,
        String clientVersion,
        Boolean updateAvailable,
        Boolean authorized,
        String expires,
        List<String> tags
) {
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Listing(List<RemoteDevice> devices) {
    }
}
