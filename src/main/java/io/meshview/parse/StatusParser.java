package io.meshview.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.meshview.model.Cidr;
import io.meshview.util.Jsons;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

public final class StatusParser {
    private final ObjectMapper mapper;

    public StatusParser() {
        this(Jsons.strictMapper());
    }

    StatusParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public RawStatus parse(byte[] bytes) throws StatusParseException {
        if (bytes == null || bytes.length == 0) {
            throw new StatusParseException("agent status output is empty");
        }
        RawStatus status;
        try {
            status = mapper.readValue(bytes, RawStatus.class);
        } catch (IOException e) {
            throw new StatusParseException("agent status is not valid status JSON: " + e.getMessage(), e);
        }
        if (status == null) {
            throw new StatusParseException("agent status output is JSON null");
        }
        if (status.self() == null) {
            throw new StatusParseException("agent status has no Self entry");
        }
        validateNode("Self", status.self());
        for (Map.Entry<String, RawStatus.Node> entry : status.peersOrEmpty().entrySet()) {
            if (entry.getValue() == null) {
                throw new StatusParseException("peer " + entry.getKey() + " is null");
            }
            validateNode("Peer[" + entry.getKey() + "]", entry.getValue());
        }
        return status;
    }

    private static void validateNode(String where, RawStatus.Node node) throws StatusParseException {
        requireText(where, "ID", node.id());
        requireText(where, "HostName", node.hostName());
        validateRoutes(where, "TailscaleIPs", node.tailscaleIps());
        validateRoutes(where, "AllowedIPs", node.allowedIps());
        validateRoutes(where, "PrimaryRoutes", node.primaryRoutes());
        validateRoutes(where, "AdvertisedRoutes", node.advertisedRoutes());
        if (node.tags() != null && node.tags().contains(null)) {
            throw new StatusParseException(where + " has a null tag");
        }
        if (node.lastSeen() != null && !node.lastSeen().isBlank()) {
            try {
                Instant.parse(node.lastSeen());
            } catch (DateTimeParseException e) {
                throw new StatusParseException(where + " has invalid LastSeen: " + node.lastSeen(), e);
            }
        }
        if (node.txBytes() != null && node.txBytes() < 0 || node.rxBytes() != null && node.rxBytes() < 0) {
            throw new StatusParseException(where + " has negative traffic counters");
        }
    }

    private static void requireText(String where, String field, String value) throws StatusParseException {
        if (value == null || value.isBlank()) {
            throw new StatusParseException(where + " is missing " + field);
        }
    }

    private static void validateRoutes(String where, String field, List<String> routes) throws StatusParseException {
        if (routes == null) {
            return;
        }
        for (String route : routes) {
            if (route == null || !Cidr.isValid(route)) {
                throw new StatusParseException(where + " has invalid " + field + " entry: " + route);
            }
        }
    }
}
