package io.meshview.parse;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record RawStatus(
        @JsonProperty("Version") String version,
        @JsonProperty("BackendState") String backendState,
        @JsonProperty("MagicDNSSuffix") String magicDnsSuffix,
        @JsonProperty("Self") Node self,
        @JsonProperty("Peer") Map<String, Node> peers
) {
    public Map<String, Node> peersOrEmpty() {
        return peers == null ? Map.of() : peers;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Node(
            @JsonProperty("ID") String id,
            @JsonProperty("HostName") String hostName,
            @JsonProperty("DNSName") String dnsName,
            @JsonProperty("OS") String os,
            @JsonProperty("TailscaleIPs") List<String> tailscaleIps,
            @JsonProperty("AllowedIPs") List<String> allowedIps,
            @JsonProperty("PrimaryRoutes") List<String> primaryRoutes,
            @JsonProperty("AdvertisedRoutes") List<String> advertisedRoutes,
            @JsonProperty("Tags") List<String> tags,
            @JsonProperty("Online") Boolean online,
            @JsonProperty("LastSeen") String lastSeen,
            @JsonProperty("ExitNode") Boolean exitNode,
            @JsonProperty("ExitNodeOption") Boolean exitNodeOption,
            @JsonProperty("TxBytes") Long txBytes,
            @JsonProperty("RxBytes") Long rxBytes
    ) {
    }
}
