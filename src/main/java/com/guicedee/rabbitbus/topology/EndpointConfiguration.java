package com.guicedee.rabbitbus.topology;

import lombok.Value;

/**
 * The naming, topology and binding options the endpoint components of a bus are created from
 */
@Value
public class EndpointConfiguration
{
    EndpointConventionOptions conventionOptions;
    TopologyOptions topologyOptions;
    AutoBindingOptions autoBindingOptions;

    public static EndpointConfiguration defaults()
    {
        return new EndpointConfigurationBuilder().build();
    }

    public EndpointConvention createEndpointConvention(MessageTopologyRegistry topologyRegistry)
    {
        return new EndpointConvention(topologyRegistry, conventionOptions);
    }
}
