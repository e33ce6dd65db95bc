package io.meshview.model;

public record SelfDevice(
        Device device,
        boolean exitNodeOption,
        String backendState,
        String agentVersion,
        String magicDnsSuffix,
        String activeExitNodeId,
        long txBytes,
        long rxBytes
) {
    public SelfDevice {
        if (device == null) {
            throw new IllegalArgumentException("self device cannot be null");
        }
    }

    public String id() {
        return device.id();
    }

    public SelfDevice withDevice(Device replacement) {
        return new SelfDevice(
                replacement,
                exitNodeOption,
                backendState,
                agentVersion,
                magicDnsSuffix,
                activeExitNodeId,
                txBytes,
                rxBytes
        );
    }
}
