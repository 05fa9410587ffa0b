package io.dagtest.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.dagtest.core.graph.GraphDescription;
import io.dagtest.core.result.RunSummary;
import io.dagtest.core.result.TestMessage;
import io.dagtest.core.result.TestResult;
import io.dagtest.serialization.mixin.NodeDescriptionMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all run report serialization in one place.
///
/// **Custom serializers** (export-only types holding live nodes or throwables):
/// - `RunSummary` via `RunSummarySerializer`
/// - `TestResult` via `TestResultSerializer`
/// - `TestMessage` via `TestMessageSerializer`
/// - `Throwable` via `ThrowableSerializer`, for every exception subtype
///
/// **Mixins** (records bound through their canonical constructor):
/// - `GraphDescription.NodeDescription` hides the derived `fixture` flag
///
/// @see RunReportSerializer for the convenience factory API
public class DagTestJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 4120587349061832716L;

    public DagTestJacksonModule() {
        super("DagTestJacksonModule");

        addSerializer(RunSummary.class, new RunSummarySerializer());
        addSerializer(TestResult.class, new TestResultSerializer());
        addSerializer(TestMessage.class, new TestMessageSerializer());
        addSerializer(Throwable.class, new ThrowableSerializer());
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(
                GraphDescription.NodeDescription.class, NodeDescriptionMixin.class);
    }
}
