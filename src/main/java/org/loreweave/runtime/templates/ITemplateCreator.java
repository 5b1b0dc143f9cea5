package org.loreweave.runtime.templates;

import com.typesafe.config.Config;
import org.loreweave.runtime.spi.IDomainSchema;
import org.loreweave.runtime.spi.IGrowthTemplate;

/**
 * Creates a growth template from its options block.
 */
@FunctionalInterface
public interface ITemplateCreator {

    /**
     * @param options the template's block, empty when none is configured
     * @param domain the domain the template generates for
     */
    IGrowthTemplate create(Config options, IDomainSchema domain);
}
