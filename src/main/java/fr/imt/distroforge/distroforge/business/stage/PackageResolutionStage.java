package fr.imt.distroforge.distroforge.business.stage;

import fr.imt.distroforge.distroforge.business.model.BuildSpecification;
import fr.imt.distroforge.distroforge.business.model.ResolvedPackages;
import fr.imt.distroforge.distroforge.business.model.ToolResult;
import fr.imt.distroforge.distroforge.business.port.PackageResolver;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class PackageResolutionStage implements PipelineStage {

    static final String DISPLAY_CATEGORY = "display";

    private final PackageResolver packageResolver;

    @Override
    public StageType type() {
        return StageType.PACKAGE_RESOLUTION;
    }

    @Override
    public StageResult run(StageContext context) {
        BuildSpecification spec = context.getSpec();

        Map<String, List<String>> categories = new LinkedHashMap<>();
        spec.packages().forEach((category, names) -> categories.put(category.getValue(), names));
        if (!spec.display().isHeadless()) {
            categories.put(DISPLAY_CATEGORY, spec.display().components());
        }

        int requested = categories.values().stream().mapToInt(List::size).sum();
        context.log("Resolving " + requested + " requested packages for " + spec.base().getValue());

        ToolResult<ResolvedPackages> result = packageResolver.resolve(spec.base(), categories, context.getLogSink());
        if (!result.isSuccess()) {
            return StageResult.failure(result.error());
        }

        ResolvedPackages resolved = result.value();
        context.setResolvedPackages(resolved);

        List<String> lines = new ArrayList<>();
        resolved.warnings().forEach(warning -> lines.add("WARNING: " + warning));
        lines.add("Resolved " + resolved.packages().size() + " distribution packages");
        return StageResult.success(lines);
    }
}
