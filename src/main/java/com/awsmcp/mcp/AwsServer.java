package com.awsmcp.mcp;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.awsmcp.mcp.api.ToolRegistry;
import com.awsmcp.mcp.provider.ProviderClients;
import com.awsmcp.mcp.services.Ec2Service;
import com.awsmcp.mcp.services.LoadBalancerService;
import com.awsmcp.mcp.services.S3Service;
import com.awsmcp.mcp.services.TransitGatewayService;
import com.awsmcp.mcp.services.VpcService;

/**
 * The tool server front-ends. Each process runs exactly one, with its own registry,
 * since some tool names (create_tags) exist on more than one front-end.
 */
public enum AwsServer {
    EC2("aws-ec2") {
        @Override
        List<Object> createServices(ProviderClients clients, GatewayConfig config) {
            return List.of(new Ec2Service(clients.ec2()));
        }
    },
    NLB("aws-nlb") {
        @Override
        List<Object> createServices(ProviderClients clients, GatewayConfig config) {
            return List.of(new LoadBalancerService(clients.elbv2()));
        }
    },
    S3("aws-s3") {
        @Override
        List<Object> createServices(ProviderClients clients, GatewayConfig config) {
            return List.of(new S3Service(clients.s3(), config.region()));
        }
    },
    TGW("aws-tgw") {
        @Override
        List<Object> createServices(ProviderClients clients, GatewayConfig config) {
            return List.of(new TransitGatewayService(clients.ec2()));
        }
    },
    VPC("aws-vpc") {
        @Override
        List<Object> createServices(ProviderClients clients, GatewayConfig config) {
            return List.of(new VpcService(clients.ec2()));
        }
    };

    private final String serverName;

    AwsServer(String serverName) {
        this.serverName = serverName;
    }

    abstract List<Object> createServices(ProviderClients clients, GatewayConfig config);

    /**
     * Build the registry holding this front-end's full tool catalog.
     */
    public ToolRegistry buildRegistry(ProviderClients clients, GatewayConfig config) {
        ToolRegistry registry = new ToolRegistry();
        for (Object service : createServices(clients, config)) {
            registry.registerAnnotated(service);
        }
        return registry;
    }

    public String serverName() {
        return serverName;
    }

    /**
     * @throws IllegalArgumentException if no front-end has that name
     */
    public static AwsServer fromName(String name) {
        for (AwsServer server : values()) {
            if (server.serverName.equalsIgnoreCase(name)) {
                return server;
            }
        }
        throw new IllegalArgumentException("Unknown server: " + name + " (expected one of " + names() + ")");
    }

    static String names() {
        return Arrays.stream(values()).map(AwsServer::serverName).collect(Collectors.joining(", "));
    }
}
