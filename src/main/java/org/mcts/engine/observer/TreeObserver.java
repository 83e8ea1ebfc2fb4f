package org.mcts.engine.observer;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.mcts.engine.event.Event;
import org.mcts.engine.event.TreeEvent;
import org.mcts.engine.event.TreeStartEvent;
import org.mcts.engine.model.CumulativeStatistics;
import org.mcts.engine.model.SearchTreeNode;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Writes a JSON snapshot of the tree after every search, one file per search, into a fresh folder.
 */
public class TreeObserver implements Observer {

    private static final Logger LOGGER = LogManager.getLogger();

    private final Gson gson = new GsonBuilder()
            .setPrettyPrinting()
            .registerTypeHierarchyAdapter(SearchTreeNode.class, new SearchTreeNodeSerializer())
            .create();
    private final File parentFolder;
    private File folder;

    public TreeObserver(File parentFolder) {
        this.parentFolder = parentFolder;
    }

    @Override
    public void observe(Event event) {
        try {
            if (event instanceof TreeStartEvent) {
                createFolder();
            } else if (event instanceof TreeEvent) {
                if (folder == null) {
                    createFolder();
                }
                writeTree((TreeEvent) event);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public File getFolder() {
        return folder;
    }

    private void createFolder() throws IOException {
        folder = new File(parentFolder, "Trees_" + System.currentTimeMillis());
        Files.createDirectories(folder.toPath());
        LOGGER.debug("Writing tree snapshots to {}", folder);
    }

    private void writeTree(TreeEvent treeEvent) throws IOException {
        JsonObject snapshot = new JsonObject();
        snapshot.addProperty("search", treeEvent.getSearchNumber());
        snapshot.addProperty("iterations", treeEvent.getIterations());
        snapshot.add("root", gson.toJsonTree(treeEvent.getTree().getRoot()));

        File f = new File(folder, "Tree_" + treeEvent.getSearchNumber() + ".json");
        try (BufferedWriter bw = Files.newBufferedWriter(f.toPath(), StandardCharsets.UTF_8)) {
            bw.write(gson.toJson(snapshot));
        }
        LOGGER.debug("Wrote {}", f);
    }

    static class SearchTreeNodeSerializer implements JsonSerializer<SearchTreeNode<?>> {
        @Override
        public JsonElement serialize(SearchTreeNode<?> src, Type typeOfSrc, JsonSerializationContext context) {
            JsonObject result = new JsonObject();
            if (src.getPrecedingAction() != null) {
                result.addProperty("action", String.valueOf(src.getPrecedingAction()));
            }
            CumulativeStatistics statistics = src.getStatistics();
            result.addProperty("visits", statistics.getNumVisits());
            result.addProperty("totalReward", statistics.getTotalReward());
            if (statistics.isVisited()) {
                result.addProperty("meanReward", statistics.getMeanReward());
            }
            result.addProperty("terminal", src.isTerminal());
            result.addProperty("untriedActions", src.getUntriedActions().size());

            JsonArray children = new JsonArray();
            for (SearchTreeNode<?> child : src.getChildren().values()) {
                children.add(serialize(child, typeOfSrc, context));
            }
            result.add("children", children);
            return result;
        }
    }
}
