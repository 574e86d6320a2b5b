package com.alertwarden.core.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/**
 * Webhook receiver. The service URI must be absolute.
 *
 * @since 1.0.0
 */
public final class WebhookReceiver extends Receiver {

    private final String serviceUri;
    private final boolean useCommonSchema;

    public WebhookReceiver(String name, String serviceUri, boolean useCommonSchema) {
        super(name);
        this.serviceUri = serviceUri != null ? serviceUri.trim() : null;
        this.useCommonSchema = useCommonSchema;
    }

    public String getServiceUri() {
        return serviceUri;
    }

    /**
     * @return parsed service URI
     * @throws IllegalStateException if the URI is malformed; call
     *                               {@link #problems()} first
     */
    public URI uri() {
        try {
            return new URI(serviceUri);
        } catch (URISyntaxException e) {
            throw new IllegalStateException("Malformed webhook URI: " + serviceUri, e);
        }
    }

    public boolean isUseCommonSchema() {
        return useCommonSchema;
    }

    @Override
    public Kind kind() {
        return Kind.WEBHOOK;
    }

    @Override
    public String target() {
        return serviceUri;
    }

    @Override
    public List<String> problems() {
        List<String> problems = new ArrayList<>();
        if (isBlank(serviceUri)) {
            problems.add("Webhook receiver '" + getName() + "' has an empty service URI");
            return problems;
        }
        try {
            URI uri = new URI(serviceUri);
            if (!uri.isAbsolute() || uri.getHost() == null) {
                problems.add("Webhook receiver '" + getName() + "' requires an absolute URI, got: '"
                        + serviceUri + "'");
            }
        } catch (URISyntaxException e) {
            problems.add("Webhook receiver '" + getName() + "' has a malformed URI: " + e.getMessage());
        }
        return problems;
    }
}
