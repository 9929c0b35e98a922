package com.ciro.jstitch.passes;

import com.ciro.jstitch.StitchOptions;
import com.ciro.jstitch.ir.DocumentNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Lista ordenada de pases. A igual {@link IrPass#order()} se respeta el orden de registro.
 */
public class PassPipeline {

    private static final Logger log = LoggerFactory.getLogger(PassPipeline.class);

    private final List<IrPass> passes = new ArrayList<>();

    public PassPipeline(List<? extends IrPass> passes) {
        this.passes.addAll(passes);
        this.passes.sort(Comparator.comparingInt(IrPass::order));
    }

    /** Estructuración + bajada de huérfanos. */
    public static PassPipeline defaults(StitchOptions options, ComponentClassifier classifier) {
        return new PassPipeline(List.of(
                new StructuringPass(options),
                new OrphanLoweringPass(classifier)));
    }

    public PassPipeline with(IrPass pass) {
        List<IrPass> all = new ArrayList<>(passes);
        all.add(pass);
        return new PassPipeline(all);
    }

    public List<IrPass> passes() {
        return List.copyOf(passes);
    }

    public void run(DocumentNode document) {
        for (IrPass pass : passes) {
            log.debug("Running {} (order {}) on '{}'", pass.name(), pass.order(), document.name);
            pass.execute(document);
        }
    }
}
