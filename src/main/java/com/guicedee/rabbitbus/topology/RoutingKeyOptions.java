package com.guicedee.rabbitbus.topology;

import lombok.Getter;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Accessors(chain = true)
public class RoutingKeyOptions
{
    private String separator = ".";
    private CasingStyle casing = CasingStyle.KebabCase;
    private boolean includeNamespace = true;
    private int namespaceDepth = 2;
    private boolean stripSuffixes = true;
    private List<String> suffixesToStrip = new ArrayList<>(EndpointNamingOptions.DEFAULT_SUFFIXES);
    private SubscriptionWildcard subscriptionWildcard = SubscriptionWildcard.Exact;

    public RoutingKeyOptions copy()
    {
        return new RoutingKeyOptions()
                .setSeparator(separator)
                .setCasing(casing)
                .setIncludeNamespace(includeNamespace)
                .setNamespaceDepth(namespaceDepth)
                .setStripSuffixes(stripSuffixes)
                .setSuffixesToStrip(suffixesToStrip == null ? null : new ArrayList<>(suffixesToStrip))
                .setSubscriptionWildcard(subscriptionWildcard);
    }
}
