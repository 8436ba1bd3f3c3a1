module io.github.cyfko.boolexpr.core {
    requires com.fasterxml.jackson.databind;
    requires java.logging;

    exports io.github.cyfko.boolexpr.core;
    exports io.github.cyfko.boolexpr.core.algebra;
    exports io.github.cyfko.boolexpr.core.api;
    exports io.github.cyfko.boolexpr.core.cache;
    exports io.github.cyfko.boolexpr.core.config;
    exports io.github.cyfko.boolexpr.core.exception;
    exports io.github.cyfko.boolexpr.core.impl;
    exports io.github.cyfko.boolexpr.core.model;
    exports io.github.cyfko.boolexpr.core.parsing;
}
