package com.awsmcp.mcp.provider;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.awsmcp.mcp.GatewayConfig;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Builds the shared, thread-safe provider clients from configuration, once each, on first use.
 * Closing releases every client built so far.
 */
public class AwsClients implements ProviderClients, AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(AwsClients.class);

    private final GatewayConfig config;
    private final List<SdkClient> built = new ArrayList<>();
    private Ec2Client ec2;
    private ElasticLoadBalancingV2Client elbv2;
    private S3Client s3;

    public AwsClients(GatewayConfig config) {
        this.config = config;
    }

    @Override
    public synchronized Ec2Client ec2() {
        if (ec2 == null) {
            LOG.info("Creating EC2 client for region {}", config.region());
            ec2 = track(Ec2Client.builder()
                .region(Region.of(config.region()))
                .credentialsProvider(credentials())
                .build());
        }
        return ec2;
    }

    @Override
    public synchronized ElasticLoadBalancingV2Client elbv2() {
        if (elbv2 == null) {
            LOG.info("Creating Elastic Load Balancing v2 client for region {}", config.region());
            elbv2 = track(ElasticLoadBalancingV2Client.builder()
                .region(Region.of(config.region()))
                .credentialsProvider(credentials())
                .build());
        }
        return elbv2;
    }

    @Override
    public synchronized S3Client s3() {
        if (s3 == null) {
            LOG.info("Creating S3 client for region {}", config.region());
            s3 = track(S3Client.builder()
                .region(Region.of(config.region()))
                .credentialsProvider(credentials())
                .build());
        }
        return s3;
    }

    /** Named profile when configured, the default provider chain otherwise. */
    private AwsCredentialsProvider credentials() {
        if (config.profile() != null) {
            LOG.info("Using AWS profile {}", config.profile());
            return ProfileCredentialsProvider.create(config.profile());
        }
        return DefaultCredentialsProvider.create();
    }

    private <C extends SdkClient> C track(C client) {
        built.add(client);
        return client;
    }

    @Override
    public synchronized void close() {
        for (SdkClient client : built) {
            try {
                client.close();
            } catch (RuntimeException e) {
                LOG.warn("Failed to close {} client", client.serviceName(), e);
            }
        }
        built.clear();
        ec2 = null;
        elbv2 = null;
        s3 = null;
    }
}
