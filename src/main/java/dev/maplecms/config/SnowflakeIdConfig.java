package dev.maplecms.config;

import dev.maplecms.util.SnowflakeId;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.net.InetAddress;
import java.net.NetworkInterface;

/**
 * Id generator bean. The node id comes from {@code app.snowflake.node-id}; without it
 * one is derived from the host's MAC address, then from its hostname.
 */
@Configuration(proxyBeanMethods = false)
@Slf4j
public class SnowflakeIdConfig {

    @Value("${app.snowflake.node-id:#{null}}")
    private Long configuredNodeId;

    @Bean
    public SnowflakeId snowflakeId() {
        long nodeId = configuredNodeId != null ? configuredNodeId : deriveNodeId();
        log.info("Snowflake id generator started with node id {}", nodeId);
        return new SnowflakeId(nodeId);
    }

    private long deriveNodeId() {
        try {
            InetAddress localHost = InetAddress.getLocalHost();
            NetworkInterface nic = NetworkInterface.getByInetAddress(localHost);
            byte[] mac = nic != null ? nic.getHardwareAddress() : null;
            if (mac != null && mac.length >= 2) {
                return (((mac[mac.length - 2] & 0xFF) << 8) | (mac[mac.length - 1] & 0xFF)) & SnowflakeId.MAX_NODE_ID;
            }
            return (localHost.getHostName().hashCode() & 0x7FFFFFFF) & SnowflakeId.MAX_NODE_ID;
        } catch (IOException e) {
            log.warn("Could not derive Snowflake node id from the network, using 0: {}", e.getMessage());
            return 0;
        }
    }
}
