package ca.gc.cra.snapline.api.junit;

import ca.gc.cra.snapline.api.SnapshotAsserter;
import ca.gc.cra.snapline.application.assertion.SnapshotAssertion;
import ca.gc.cra.snapline.application.assertion.SnapshotNamer;
import ca.gc.cra.snapline.config.SettingsMerger;
import ca.gc.cra.snapline.config.SnapshotSettings;
import ca.gc.cra.snapline.infrastructure.capture.DefaultContentCapture;
import ca.gc.cra.snapline.infrastructure.persistence.FileSnapshotStore;
import ca.gc.cra.snapline.logging.LoggingConfigurator;
import java.lang.reflect.Method;
import java.util.Objects;
import org.junit.jupiter.api.extension.ExtensionContext;
import org.junit.jupiter.api.extension.ParameterContext;
import org.junit.jupiter.api.extension.ParameterResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JUnit 5 extension injecting a {@link SnapshotAsserter} into test methods.
 *
 * <p>The asserter records snapshots under the test class as module and the test method name as default snapshot
 * name, so {@code UserTest#rendersProfile} writes {@code snapshots/UserTest__rendersProfile.snap}. Each test method
 * gets its own naming sequence; invocations of a {@code @RepeatedTest} or {@code @ParameterizedTest} share it, so
 * the second invocation writes {@code UserTest__rendersProfile-2.snap}. Settings are resolved once per engine run unless supplied through
 * {@link #withSettings(SnapshotSettings)}.</p>
 *
 * <pre>{@code
 * @ExtendWith(SnapshotExtension.class)
 * class UserTest {
 *   @Test
 *   void rendersProfile(SnapshotAsserter snapshots) {
 *     snapshots.assertJson(profile, RedactionRule.of(".id", "[id]"));
 *   }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class SnapshotExtension implements ParameterResolver {
  private static final Logger log = LoggerFactory.getLogger(SnapshotExtension.class);
  private static final ExtensionContext.Namespace NAMESPACE =
      ExtensionContext.Namespace.create(SnapshotExtension.class);

  private final SnapshotSettings fixedSettings;

  /** Resolves settings from the environment on first use. */
  public SnapshotExtension() {
    this(null);
  }

  private SnapshotExtension(SnapshotSettings fixedSettings) {
    this.fixedSettings = fixedSettings;
  }

  /**
   * Creates an extension for {@code @RegisterExtension} that ignores environment settings.
   *
   * @param settings settings to run with
   * @return extension
   */
  public static SnapshotExtension withSettings(SnapshotSettings settings) {
    return new SnapshotExtension(Objects.requireNonNull(settings, "settings"));
  }

  @Override
  public boolean supportsParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
    return parameterContext.getParameter().getType() == SnapshotAsserter.class;
  }

  @Override
  public Object resolveParameter(ParameterContext parameterContext, ExtensionContext extensionContext) {
    SnapshotSettings settings = settings(extensionContext);
    SnapshotAssertion assertion =
        new SnapshotAssertion(new FileSnapshotStore(), DefaultContentCapture.create(), namer(extensionContext));
    String module = extensionContext.getRequiredTestClass().getName();
    String name = extensionContext.getTestMethod().map(Method::getName).orElse(null);
    log.debug("Binding snapshots of {}#{} under {}", module, name, settings.workspaceRoot());
    return SnapshotAsserter.create(assertion, settings, module, name);
  }

  private static SnapshotNamer namer(ExtensionContext context) {
    // Template invocations hang below a method-level context; plain tests below the class context.
    ExtensionContext scope = context.getParent()
        .filter(parent -> parent.getTestMethod().isPresent())
        .orElse(context);
    return scope.getStore(NAMESPACE)
        .getOrComputeIfAbsent(SnapshotNamer.class, key -> new SnapshotNamer(), SnapshotNamer.class);
  }

  private SnapshotSettings settings(ExtensionContext context) {
    if (fixedSettings != null) {
      return fixedSettings;
    }
    return context.getRoot().getStore(NAMESPACE)
        .getOrComputeIfAbsent(SnapshotSettings.class, key -> load(), SnapshotSettings.class);
  }

  private static SnapshotSettings load() {
    SnapshotSettings settings = SettingsMerger.resolve(log::warn);
    if (settings.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    return settings;
  }
}
