package ca.gc.cra.beacon.infrastructure.yaml;

import ca.gc.cra.beacon.domain.config.BuildIdGenerator;
import ca.gc.cra.beacon.domain.config.ConfigFactory;
import java.lang.reflect.InvocationTargetException;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.constructor.AbstractConstruct;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.ScalarNode;
import org.yaml.snakeyaml.nodes.Tag;

/**
 * Safe constructor that also understands {@code !hook <class>} scalars.
 *
 * <p>The named class must have a public no-argument constructor and implement {@link ConfigFactory} or
 * {@link BuildIdGenerator}. Everything else is constructed as plain maps, lists and scalars; timestamps and
 * {@code !!binary} values keep their scalar text.</p>
 */
final class HookConstructor extends SafeConstructor {
  static final Tag HOOK_TAG = new Tag("!hook");

  HookConstructor(LoaderOptions options) {
    super(options);
    this.yamlConstructors.put(HOOK_TAG, new ConstructHook());
    this.yamlConstructors.put(Tag.TIMESTAMP, new ConstructYamlStr());
    this.yamlConstructors.put(Tag.BINARY, new ConstructYamlStr());
  }

  private final class ConstructHook extends AbstractConstruct {
    @Override
    public Object construct(Node node) {
      if (!(node instanceof ScalarNode scalar)) {
        throw new YAMLException("!hook expects a class name " + node.getStartMark());
      }
      String className = String.valueOf(constructScalar(scalar)).trim();
      return instantiate(className);
    }
  }

  static Object instantiate(String className) {
    Class<?> type;
    try {
      type = Class.forName(className, true, Thread.currentThread().getContextClassLoader());
    } catch (ClassNotFoundException ex) {
      throw new YAMLException("Hook class not found: " + className, ex);
    }
    if (!ConfigFactory.class.isAssignableFrom(type) && !BuildIdGenerator.class.isAssignableFrom(type)) {
      throw new YAMLException(
          "Hook class " + className + " must implement ConfigFactory or BuildIdGenerator");
    }
    try {
      return type.getDeclaredConstructor().newInstance();
    } catch (NoSuchMethodException | InstantiationException | IllegalAccessException ex) {
      throw new YAMLException("Hook class " + className + " needs a public no-argument constructor", ex);
    } catch (InvocationTargetException ex) {
      throw new YAMLException("Hook class " + className + " failed to initialize", ex.getCause());
    }
  }
}
