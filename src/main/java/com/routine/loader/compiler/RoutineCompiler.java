package com.routine.loader.compiler;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.compiler.catalog.CatalogReconciler;
import com.routine.loader.compiler.catalog.ReconciledRoutine;
import com.routine.loader.compiler.doc.DefaultDocBlockTokenizer;
import com.routine.loader.compiler.doc.DocBlockTokenizer;
import com.routine.loader.compiler.doc.DocumentationReconciler;
import com.routine.loader.compiler.executor.RoutineExecutor;
import com.routine.loader.compiler.metadata.BuildMetadata;
import com.routine.loader.compiler.metadata.MetadataSynthesizer;
import com.routine.loader.compiler.metadata.RoutineDocumentation;
import com.routine.loader.compiler.staleness.StalenessDetector;
import com.routine.loader.database.DataLayer;
import com.routine.loader.database.DataLayerException;
import com.routine.loader.database.DatabaseUnavailableException;
import com.routine.loader.model.RoutineSource;
import com.routine.loader.parser.AnnotationScanner;
import com.routine.loader.parser.RoutineAnnotations;
import com.routine.loader.parser.RoutineSourceReader;

/**
 * Loads a single stored routine from its source file into the database and produces its new metadata.
 *
 * Pipeline:
 * 1. Staleness check (stops here when the routine is up to date)
 * 2. Scan placeholders, designation, extended parameters and header
 * 3. Drop and create the routine
 * 4. Read parameters (and the bulk insert table) back from the catalog
 * 5. Reconcile documentation and map parameter types
 * 6. Assemble the metadata
 *
 * Any failure stops the routine at hand and is returned as a {@link CompileResult.Status#FAILED} result.
 * Only a {@link DatabaseUnavailableException} escapes.
 */
public class RoutineCompiler {
    private static final Logger log = LoggerFactory.getLogger(RoutineCompiler.class);

    private final RoutineSourceReader sourceReader;
    private final StalenessDetector stalenessDetector;
    private final AnnotationScanner annotationScanner;
    private final RoutineExecutor executor;
    private final CatalogReconciler catalogReconciler;
    private final DocumentationReconciler documentationReconciler;
    private final MetadataSynthesizer metadataSynthesizer;

    public RoutineCompiler(DataLayer dataLayer) {
        this(dataLayer, new DefaultDocBlockTokenizer());
    }

    public RoutineCompiler(DataLayer dataLayer, DocBlockTokenizer tokenizer) {
        this.sourceReader = new RoutineSourceReader();
        this.stalenessDetector = new StalenessDetector();
        this.annotationScanner = new AnnotationScanner();
        this.executor = new RoutineExecutor(dataLayer);
        this.catalogReconciler = new CatalogReconciler(dataLayer, executor);
        this.documentationReconciler = new DocumentationReconciler(tokenizer);
        this.metadataSynthesizer = new MetadataSynthesizer();
    }

    public CompileResult compile(CompileRequest request) {
        Path file = request.getSourceFile();
        String routineName = RoutineSourceReader.routineName(file, request.getExtension());
        CompileDiagnostics diagnostics = new CompileDiagnostics();

        try {
            long lastModified = sourceReader.lastModified(file);
            if (!stalenessDetector.mustReload(request.getPrevious(), lastModified, request.getReplacePairs(),
                    request.getCatalogEntry(), request.getSessionSettings())) {
                log.debug("{} is up to date", routineName);
                return CompileResult.upToDate(file, request.getPrevious());
            }

            RoutineSource source = sourceReader.read(file, request.getExtension());

            RoutineAnnotations annotations = annotationScanner.scan(source, request.getReplacePairs());

            executor.load(source, annotations, request.getCatalogEntry(), request.getSessionSettings());

            ReconciledRoutine reconciled = catalogReconciler.reconcile(source, annotations);

            RoutineDocumentation documentation = documentationReconciler.reconcile(source, annotations.getHeader(),
                    reconciled.getParameters(), diagnostics);

            BuildMetadata metadata = metadataSynthesizer.synthesize(source, annotations, reconciled, documentation);

            return CompileResult.loaded(file, metadata, diagnostics.getWarnings());

        } catch (RoutineCompileException | DataLayerException e) {
            return fail(routineName, file, e.getMessage(), diagnostics);
        } catch (IOException | UncheckedIOException e) {
            return fail(routineName, file, String.format("Unable to read file '%s': %s", file, e.getMessage()),
                    diagnostics);
        }
    }

    private static CompileResult fail(String routineName, Path file, String message, CompileDiagnostics diagnostics) {
        log.error("Error: {}", message);
        diagnostics.getErrors().add(message);
        return CompileResult.failure(routineName, file, message, diagnostics.getWarnings());
    }
}
