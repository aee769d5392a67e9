package org.javai.pegtree.tree.config;

import java.io.InputStream;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.javai.pegtree.tree.NodeTransform;
import org.javai.pegtree.tree.TransformPolicy;
import org.javai.pegtree.tree.TreeSelection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads a {@link TreeSelection} from YAML.
 *
 * <pre>
 * store_all: false
 * prune_unselected_leaves: true
 * rules:
 *   digit: keep
 *   expr: fold-one
 *   block: discard-empty
 *   comment: remove-content
 *   call: flatten-arguments   # custom transform registered with withTransform
 * </pre>
 *
 * Transform names are the {@link TransformPolicy#configName() policy names} plus
 * any custom transforms registered on the loader.
 */
public class TreeSelectionLoader {

	private static final Logger logger = LoggerFactory.getLogger(TreeSelectionLoader.class);

	private static final Set<String> KNOWN_KEYS = Set.of("store_all", "prune_unselected_leaves", "rules");

	private final Yaml yaml = new Yaml();
	private final Map<String, NodeTransform> customTransforms = new LinkedHashMap<>();

	/**
	 * Makes a custom transform available under {@code name} in configuration files.
	 *
	 * @throws IllegalArgumentException if the name is taken by a built-in policy or another custom transform
	 */
	public TreeSelectionLoader withTransform(String name, NodeTransform transform) {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(transform, "transform must not be null");
		for (TransformPolicy policy : TransformPolicy.values()) {
			if (policy.configName().equals(name)) {
				throw new IllegalArgumentException("'" + name + "' is a built-in transform policy");
			}
		}
		if (customTransforms.putIfAbsent(name, transform) != null) {
			throw new IllegalArgumentException("Transform '" + name + "' is already registered");
		}
		return this;
	}

	public TreeSelection load(Path path) {
		try (var reader = Files.newBufferedReader(path)) {
			return load(reader);
		} catch (TreeConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new TreeConfigurationException("Failed to load tree selection from path: " + path, e);
		}
	}

	public TreeSelection load(InputStream inputStream) {
		try {
			return build(yaml.load(inputStream));
		} catch (TreeConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new TreeConfigurationException("Failed to load tree selection from input stream", e);
		}
	}

	public TreeSelection load(Reader reader) {
		try {
			return build(yaml.load(reader));
		} catch (TreeConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new TreeConfigurationException("Failed to load tree selection from reader", e);
		}
	}

	public TreeSelection loadString(String yamlContent) {
		try {
			return build(yaml.load(yamlContent));
		} catch (TreeConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new TreeConfigurationException("Failed to load tree selection from string", e);
		}
	}

	/**
	 * Loads a classpath resource with this class' loader.
	 *
	 * @throws TreeConfigurationException if the resource cannot be found or parsed
	 */
	public TreeSelection loadResource(String resourcePath) {
		Objects.requireNonNull(resourcePath, "resourcePath must not be null");
		try (InputStream is = TreeSelectionLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
			if (is == null) {
				throw new TreeConfigurationException("Resource not found: " + resourcePath);
			}
			TreeSelection selection = load(is);
			logger.debug("Loaded {} from {}", selection, resourcePath);
			return selection;
		} catch (TreeConfigurationException e) {
			throw e;
		} catch (Exception e) {
			throw new TreeConfigurationException("Failed to load tree selection from resource: " + resourcePath, e);
		}
	}

	private TreeSelection build(Object document) {
		if (document == null) {
			throw new TreeConfigurationException("Tree selection configuration is empty");
		}
		if (!(document instanceof Map<?, ?> data)) {
			throw new TreeConfigurationException("Expected a mapping at the top level, found: "
					+ document.getClass().getSimpleName());
		}
		for (Object key : data.keySet()) {
			if (!KNOWN_KEYS.contains(String.valueOf(key))) {
				logger.warn("Ignoring unknown tree selection key '{}'", key);
			}
		}

		TreeSelection.Builder builder = TreeSelection.builder()
				.storeAll(toBoolean(data.get("store_all"), false, "store_all"))
				.pruneUnselectedLeaves(toBoolean(data.get("prune_unselected_leaves"), true, "prune_unselected_leaves"));

		Object rules = data.get("rules");
		if (rules != null) {
			if (!(rules instanceof Map<?, ?> rulesMap)) {
				throw new TreeConfigurationException("'rules' must be a mapping of rule id to transform");
			}
			for (Map.Entry<?, ?> entry : rulesMap.entrySet()) {
				String ruleId = String.valueOf(entry.getKey());
				String transformName = entry.getValue() == null ? TransformPolicy.KEEP.configName()
						: String.valueOf(entry.getValue());
				builder.apply(resolveTransform(ruleId, transformName), ruleId);
			}
		}
		return builder.build();
	}

	private NodeTransform resolveTransform(String ruleId, String name) {
		NodeTransform custom = customTransforms.get(name);
		if (custom != null) {
			return custom;
		}
		try {
			return TransformPolicy.fromConfigName(name);
		} catch (IllegalArgumentException e) {
			throw new TreeConfigurationException("Invalid transform for rule '" + ruleId + "': " + e.getMessage(), e);
		}
	}

	private static boolean toBoolean(Object value, boolean defaultValue, String key) {
		if (value == null) {
			return defaultValue;
		}
		if (value instanceof Boolean b) {
			return b;
		}
		throw new TreeConfigurationException("'" + key + "' must be true or false, found: " + value);
	}
}
