package com.awsmcp.mcp.provider;

import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.elasticloadbalancingv2.ElasticLoadBalancingV2Client;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Source of the provider clients a front-end needs. Only the clients actually requested get built.
 */
public interface ProviderClients {
    Ec2Client ec2();

    ElasticLoadBalancingV2Client elbv2();

    S3Client s3();
}
