package com.routine.loader.batch;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.batch.service.MetadataStore;
import com.routine.loader.batch.service.PlaceholderTableService;
import com.routine.loader.batch.service.RoutineCatalogService;
import com.routine.loader.batch.service.RoutineDiscoveryService;
import com.routine.loader.compiler.CompileRequest;
import com.routine.loader.compiler.CompileResult;
import com.routine.loader.compiler.RoutineCompiler;
import com.routine.loader.compiler.metadata.BuildMetadata;
import com.routine.loader.database.DataLayer;
import com.routine.loader.database.DataLayerException;
import com.routine.loader.database.DatabaseUnavailableException;
import com.routine.loader.model.RoutineCatalogEntry;
import com.routine.loader.model.SessionSettings;
import com.routine.loader.parser.RoutineSourceReader;

/**
 * Loads all stored routines of a source directory into the database, one at a time, and maintains the
 * metadata file.
 *
 * A routine that fails to load keeps its previous metadata and does not stop the other routines.
 */
public class RoutineLoader {
    private static final Logger log = LoggerFactory.getLogger(RoutineLoader.class);

    private final LoaderConfig config;
    private final RoutineCompiler compiler;
    private final RoutineDiscoveryService discoveryService;
    private final PlaceholderTableService placeholderService;
    private final RoutineCatalogService catalogService;
    private final MetadataStore metadataStore;

    public RoutineLoader(LoaderConfig config, DataLayer dataLayer) {
        this(config, dataLayer, new RoutineCompiler(dataLayer));
    }

    public RoutineLoader(LoaderConfig config, DataLayer dataLayer, RoutineCompiler compiler) {
        this.config = config;
        this.compiler = compiler;
        this.discoveryService = new RoutineDiscoveryService();
        this.placeholderService = new PlaceholderTableService(dataLayer);
        this.catalogService = new RoutineCatalogService(dataLayer);
        this.metadataStore = new MetadataStore();
    }

    /**
     * Loads the routines. A lost database connection stops the run; the metadata file is then left untouched.
     */
    public LoaderResult load() {
        try {
            return loadRoutines();
        } catch (DatabaseUnavailableException e) {
            log.error("Database unavailable, loading aborted: {}", e.getMessage());
            return LoaderResult.failure("Database unavailable: " + e.getMessage());
        }
    }

    private LoaderResult loadRoutines() {
        SessionSettings settings;
        Map<String, BuildMetadata> previous;
        Map<String, Path> sources;
        Map<String, String> replacePairs;
        Map<String, RoutineCatalogEntry> catalog;
        Set<String> duplicates = new HashSet<>();
        List<String> batchErrors = new ArrayList<>();
        try {
            settings = catalogService.resolveSessionSettings(config.getSessionSettings());
            replacePairs = placeholderService.buildReplacePairs(config.getPlaceholderFile());
            previous = metadataStore.load(config.getMetadataFile());
            sources = findSources(duplicates, batchErrors);
            catalog = catalogService.findRoutines();
        } catch (IOException e) {
            log.error("Unable to prepare loading of stored routines", e);
            return LoaderResult.failure(e.getMessage());
        } catch (DataLayerException e) {
            log.error("Unable to prepare loading of stored routines: {}", e.getMessage());
            return LoaderResult.failure(e.getMessage());
        }

        Map<String, Path> selected = selectRoutines(sources, batchErrors);

        Map<String, BuildMetadata> current = new TreeMap<>(previous);
        List<CompileResult> failures = new ArrayList<>();
        int loaded = 0;
        int upToDate = 0;
        int warnings = 0;

        for (Map.Entry<String, Path> entry : selected.entrySet()) {
            String routineName = entry.getKey();

            CompileResult result = compiler.compile(CompileRequest.builder()
                    .sourceFile(entry.getValue())
                    .extension(config.getExtension())
                    .previous(previous.get(routineName))
                    .replacePairs(replacePairs)
                    .catalogEntry(catalog.get(routineName))
                    .sessionSettings(settings)
                    .build());

            warnings += result.getWarnings().size();
            switch (result.getStatus()) {
                case LOADED -> {
                    loaded++;
                    current.put(routineName, result.getMetadata());
                }
                case UP_TO_DATE -> upToDate++;
                case FAILED -> failures.add(result);
            }
        }

        List<String> dropped = new ArrayList<>();
        if (!config.isSelectiveLoad()) {
            Set<String> known = new HashSet<>(sources.keySet());
            known.addAll(duplicates);
            current.keySet().retainAll(known);
            dropped.addAll(dropObsoleteRoutines(catalog, known, batchErrors));
        }

        try {
            metadataStore.save(config.getMetadataFile(), current);
        } catch (IOException e) {
            log.error("Unable to write metadata file {}", config.getMetadataFile(), e);
            return LoaderResult.failure("Unable to write metadata file: " + e.getMessage());
        }

        return LoaderResult.builder()
                .success(failures.isEmpty() && batchErrors.isEmpty())
                .routinesFound(sources.size())
                .routinesLoaded(loaded)
                .routinesUpToDate(upToDate)
                .warningCount(warnings)
                .failures(List.copyOf(failures))
                .batchErrors(List.copyOf(batchErrors))
                .droppedRoutines(List.copyOf(dropped))
                .build();
    }

    /**
     * Maps routine names to source files. Routine names that occur more than once are reported, collected in
     * {@code duplicates} and left out of the map.
     */
    private Map<String, Path> findSources(Set<String> duplicates, List<String> batchErrors) throws IOException {
        List<Path> files = discoveryService.discoverRoutineFiles(config.getSourceDir(), config.getExtension(),
                config.isRecursive());

        Map<String, List<Path>> byName = new TreeMap<>();
        for (Path file : files) {
            byName.computeIfAbsent(RoutineSourceReader.routineName(file, config.getExtension()),
                    k -> new ArrayList<>()).add(file);
        }

        Map<String, Path> sources = new LinkedHashMap<>();
        for (Map.Entry<String, List<Path>> entry : byName.entrySet()) {
            if (entry.getValue().size() > 1) {
                String error = String.format("Files with the same routine name '%s': %s",
                        entry.getKey(), entry.getValue());
                log.error(error);
                batchErrors.add(error);
                duplicates.add(entry.getKey());
                continue;
            }
            sources.put(entry.getKey(), entry.getValue().get(0));
        }

        log.info("Found {} stored routine source file(s) in {}", sources.size(), config.getSourceDir());
        return sources;
    }

    private Map<String, Path> selectRoutines(Map<String, Path> sources, List<String> batchErrors) {
        if (!config.isSelectiveLoad()) {
            return sources;
        }

        Map<String, Path> selected = new LinkedHashMap<>();
        for (String routineName : config.getRoutineNames()) {
            Path file = sources.get(routineName);
            if (file == null) {
                String error = String.format("Unable to find the source file of stored routine '%s'.", routineName);
                log.error(error);
                batchErrors.add(error);
            } else {
                selected.put(routineName, file);
            }
        }
        return selected;
    }

    /**
     * Drops the routines in the catalog whose name is not in {@code known}. A drop that fails is reported and
     * the remaining routines are still dropped.
     */
    private List<String> dropObsoleteRoutines(Map<String, RoutineCatalogEntry> catalog, Set<String> known,
            List<String> batchErrors) {
        List<String> dropped = new ArrayList<>();
        for (RoutineCatalogEntry entry : catalog.values()) {
            if (known.contains(entry.getRoutineName())) {
                continue;
            }
            try {
                catalogService.dropRoutine(entry);
                dropped.add(entry.getRoutineName());
            } catch (DataLayerException e) {
                String error = String.format("Unable to drop %s %s: %s", entry.getKind().sqlKeyword(),
                        entry.getRoutineName(), e.getMessage());
                log.error(error);
                batchErrors.add(error);
            }
        }
        return dropped;
    }
}
