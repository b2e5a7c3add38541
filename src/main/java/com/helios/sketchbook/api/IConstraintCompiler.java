package com.helios.sketchbook.api;

import com.helios.sketchbook.engine.ColorSet;
import com.helios.sketchbook.model.properties.StatProperty;

/**
 * Contract for translating static property templates into colour constraints of one transition graph.
 */
public interface IConstraintCompiler {

    /**
     * @param property static property to translate
     * @return colours of the graph satisfying the property
     * @throws com.helios.sketchbook.core.error.NotYetSupportedException for variants without a translation
     * @throws com.helios.sketchbook.core.error.ReferenceException if the property names unknown variables
     */
    ColorSet compile(StatProperty property);
}
