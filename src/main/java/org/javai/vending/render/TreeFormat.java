package org.javai.vending.render;

import java.util.Locale;

/**
 * The available tree views.
 */
public enum TreeFormat {

	VISUAL("visual", "Visual"),
	INDENTED("indented", "Indented");

	private final String key;
	private final String displayName;

	TreeFormat(String key, String displayName) {
		this.key = key;
		this.displayName = displayName;
	}

	public String key() {
		return key;
	}

	public String displayName() {
		return displayName;
	}

	public TreeRenderer renderer() {
		return this == VISUAL ? new VisualTreeRenderer() : new IndentedTreeRenderer();
	}

	public static TreeFormat fromKey(String key) {
		if (key == null) {
			throw new IllegalArgumentException("Tree format must not be null");
		}
		String normalized = key.trim().toLowerCase(Locale.ROOT);
		for (TreeFormat format : values()) {
			if (format.key.equals(normalized)) {
				return format;
			}
		}
		throw new IllegalArgumentException("Unknown tree format: '" + key + "' (expected 'visual' or 'indented')");
	}
}
