package edu.stanford.futuredata.shardview.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.stanford.futuredata.shardview.utilities.Utilities;
import org.apache.curator.RetryPolicy;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Configuration catalog kept in ZooKeeper, one JSON document per category under
 * {@code /config/<category>}.
 */
public class ZKConfigCatalog implements ConfigCatalog, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ZKConfigCatalog.class);

    public static final String ROOT = "/config";

    private final CuratorFramework cf;

    public ZKConfigCatalog(String zkHost, int zkPort) {
        String connectString = String.format("%s:%d", zkHost, zkPort);
        RetryPolicy retryPolicy = new ExponentialBackoffRetry(1000, 3);
        this.cf = CuratorFrameworkFactory.newClient(connectString, retryPolicy);
        cf.start();
    }

    @Override
    public void close() {
        cf.close();
    }

    @Override
    public Optional<ObjectNode> fetchCategory(String category) {
        try {
            String path = categoryPath(category);
            if (cf.checkExists().forPath(path) == null) {
                return Optional.empty();
            }
            byte[] b = cf.getData().forPath(path);
            JsonNode document = Utilities.objectMapper.readTree(new String(b, StandardCharsets.UTF_8));
            if (!document.isObject()) {
                logger.warn("Config category {} is not a JSON object", category);
                return Optional.empty();
            }
            return Optional.of((ObjectNode) document);
        } catch (Exception e) {
            logger.error("ZK Failure {}", e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public boolean storeCategory(String category, ObjectNode document) {
        try {
            String path = categoryPath(category);
            byte[] data = Utilities.encode(document).getBytes(StandardCharsets.UTF_8);
            if (cf.checkExists().forPath(path) != null) {
                cf.setData().forPath(path, data);
            } else {
                cf.create().creatingParentsIfNeeded().forPath(path, data);
            }
            return true;
        } catch (Exception e) {
            logger.error("ZK Failure {}", e.getMessage());
            return false;
        }
    }

    private static String categoryPath(String category) {
        return String.format("%s/%s", ROOT, category.replace('/', '_'));
    }
}
