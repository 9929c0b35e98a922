package com.ciro.jstitch;

import com.ciro.jstitch.diagnostics.InternalCompilerException;
import com.ciro.jstitch.diagnostics.IrDiagnostic;
import com.ciro.jstitch.ir.DocumentNode;
import com.ciro.jstitch.ir.IrNode;
import com.ciro.jstitch.passes.ComponentClassifier;
import com.ciro.jstitch.passes.PassPipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Driver de un lote de documentos. Un fallo interno aborta solo el documento en el que ocurre.
 */
public class StitchCompiler {

    private static final Logger log = LoggerFactory.getLogger(StitchCompiler.class);

    private final PassPipeline pipeline;

    public StitchCompiler(PassPipeline pipeline) {
        this.pipeline = pipeline;
    }

    public StitchCompiler(StitchOptions options, ComponentClassifier classifier) {
        this(PassPipeline.defaults(options, classifier));
    }

    public CompileResult compile(DocumentNode document) {
        try {
            pipeline.run(document);
        } catch (InternalCompilerException e) {
            log.error("Aborted document '{}'", document.name, e);
            return new CompileResult(document, collectDiagnostics(document), e);
        }
        List<IrDiagnostic> diagnostics = collectDiagnostics(document);
        if (!diagnostics.isEmpty()) {
            log.debug("Document '{}' compiled with {} diagnostics", document.name, diagnostics.size());
        }
        return new CompileResult(document, diagnostics, null);
    }

    public List<CompileResult> compileAll(List<DocumentNode> documents) {
        List<CompileResult> results = new ArrayList<>(documents.size());
        for (DocumentNode document : documents) {
            results.add(compile(document));
        }
        return results;
    }

    /** Diagnósticos de todo el árbol, en orden de documento. */
    public static List<IrDiagnostic> collectDiagnostics(IrNode root) {
        List<IrDiagnostic> into = new ArrayList<>();
        collect(root, into);
        return into;
    }

    private static void collect(IrNode node, List<IrDiagnostic> into) {
        into.addAll(node.diagnostics);
        for (IrNode child : node.children) collect(child, into);
    }
}
