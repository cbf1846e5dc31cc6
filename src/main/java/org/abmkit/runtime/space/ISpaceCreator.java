package org.abmkit.runtime.space;

import com.typesafe.config.Config;

/**
 * Builds a space from its configuration block.
 */
@FunctionalInterface
public interface ISpaceCreator {
    ISpace<?> create(Config config);
}
