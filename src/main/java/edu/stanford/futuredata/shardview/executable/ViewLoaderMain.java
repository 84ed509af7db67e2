package edu.stanford.futuredata.shardview.executable;

import com.fasterxml.jackson.databind.JsonNode;
import edu.stanford.futuredata.shardview.broker.StreamChunkTransport;
import edu.stanford.futuredata.shardview.broker.ViewBroker;
import edu.stanford.futuredata.shardview.config.ConfigCache;
import edu.stanford.futuredata.shardview.config.ZKConfigCatalog;
import edu.stanford.futuredata.shardview.datastore.LocalViewStore;
import edu.stanford.futuredata.shardview.datastore.MonthlyShardResolver;
import edu.stanford.futuredata.shardview.utilities.*;
import org.apache.commons.cli.*;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.javatuples.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collection;

/**
 * Runs one view load against shards read from a directory of {@code <shard>.json} files
 * ({@code %2F} in a file name stands for "/").  Prints the buffered response, or streams it when
 * -chunked is given.
 */
public class ViewLoaderMain {

    private static final Logger logger = LoggerFactory.getLogger(ViewLoaderMain.class);

    public static void main(String[] args) throws Exception {
        Options options = new Options();
        options.addOption("d", true, "Directory of shard files");
        options.addOption("view", true, "View name");
        options.addOption("account", true, "Account ID");
        options.addOption("range", false, "Time-bounded load?");
        options.addOption("partitioned", false, "Time-bounded load over monthly shards?");
        options.addOption("from", true, "Range start (epoch seconds)");
        options.addOption("to", true, "Range end (epoch seconds)");
        options.addOption("startkey", true, "Start key (JSON)");
        options.addOption("endkey", true, "End key (JSON)");
        options.addOption("limit", true, "Page size");
        options.addOption("descending", false, "Descending order?");
        options.addOption("chunked", false, "Stream the response as chunks?");
        options.addOption("zk", true, "ZooKeeper host:port for configuration");
        options.addOption("node", true, "Node name for configuration lookups");

        CommandLineParser parser = new DefaultParser();
        CommandLine cmd = parser.parse(options, args);
        if (!cmd.hasOption("d") || !cmd.hasOption("view")) {
            new HelpFormatter().printHelp("ViewLoaderMain", options);
            return;
        }

        LocalViewStore store = new LocalViewStore();
        loadShards(store, new File(cmd.getOptionValue("d")));

        String node = cmd.getOptionValue("node", "default");
        ZKConfigCatalog catalog = null;
        if (cmd.hasOption("zk")) {
            Pair<String, Integer> hostPort = Utilities.parseConnectString(cmd.getOptionValue("zk"));
            catalog = new ZKConfigCatalog(hostPort.getValue0(), hostPort.getValue1());
        }
        try {
            ConfigCache config = new ConfigCache(node, catalog);
            ViewBroker broker = new ViewBroker(store, config, new MonthlyShardResolver());
            run(cmd, broker);
        } finally {
            if (catalog != null) {
                catalog.close();
            }
        }
    }

    private static void run(CommandLine cmd, ViewBroker broker) throws IOException {
        ViewRequest.Builder request = ViewRequest.builder()
                .accountId(cmd.getOptionValue("account"))
                .paginate(cmd.hasOption("limit"));
        if (cmd.hasOption("limit")) {
            request.pageSize(Integer.parseInt(cmd.getOptionValue("limit")));
        }
        if (cmd.hasOption("startkey")) {
            request.requestValue(ViewRequest.START_KEY, Utilities.objectMapper.readTree(cmd.getOptionValue("startkey")));
        }
        if (cmd.hasOption("endkey")) {
            request.requestValue(ViewRequest.END_KEY, Utilities.objectMapper.readTree(cmd.getOptionValue("endkey")));
        }
        if (cmd.hasOption("descending")) {
            request.requestValue(ViewOptions.DESCENDING, true);
        }
        if (cmd.hasOption("from")) {
            request.requestValue(ViewOptions.CREATED_FROM, Long.parseLong(cmd.getOptionValue("from")));
        }
        if (cmd.hasOption("to")) {
            request.requestValue(ViewOptions.CREATED_TO, Long.parseLong(cmd.getOptionValue("to")));
        }

        ViewOptions loadOptions = new ViewOptions();
        StreamChunkTransport transport = null;
        if (cmd.hasOption("chunked")) {
            transport = new StreamChunkTransport(System.out);
            loadOptions.set(ViewOptions.IS_CHUNKED, true).set(ViewOptions.TRANSPORT, transport);
        }

        String view = cmd.getOptionValue("view");
        ViewResponse response;
        if (cmd.hasOption("partitioned")) {
            response = broker.loadPartitioned(request.build(), view, loadOptions);
        } else if (cmd.hasOption("range")) {
            response = broker.loadRange(request.build(), view, loadOptions);
        } else {
            response = broker.load(request.build(), view, loadOptions);
        }

        if (response.isChunked()) {
            System.out.println();
        } else {
            System.out.println(Utilities.encode(response.toJson()));
        }
        if (!response.isSuccess()) {
            logger.warn("Load of {} failed: {}", view, response.getError().orElse(null));
        }
    }

    private static void loadShards(LocalViewStore store, File dir) throws IOException {
        Collection<File> files = FileUtils.listFiles(dir, new String[]{"json"}, false);
        for (File file: files) {
            String shard = FilenameUtils.getBaseName(file.getName()).replace("%2F", "/");
            JsonNode document = Utilities.objectMapper.readTree(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
            store.loadShard(shard, document);
        }
        logger.info("Loaded {} shards from {}", files.size(), dir);
    }
}
