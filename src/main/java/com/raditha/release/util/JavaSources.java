package com.raditha.release.util;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.symbolsolver.JavaSymbolSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.CombinedTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.JavaParserTypeSolver;
import com.github.javaparser.symbolsolver.resolution.typesolvers.ReflectionTypeSolver;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;

/**
 * Factory for configured {@link JavaParser} instances. A parser is not safe
 * to share between threads, so callers make one per worker.
 */
public class JavaSources {

    private JavaSources() {
        /* this is only a utility class */
    }

    /**
     * Parser for the Java 17 language level without type resolution.
     */
    public static JavaParser syntaxParser() {
        return new JavaParser(baseConfiguration());
    }

    /**
     * Parser whose compilation units can resolve symbols against the JDK and
     * the given source roots.
     */
    public static JavaParser symbolParser(Collection<Path> sourceRoots) {
        CombinedTypeSolver typeSolver = new CombinedTypeSolver();
        typeSolver.add(new ReflectionTypeSolver());
        for (Path root : sourceRoots) {
            if (Files.isDirectory(root)) {
                typeSolver.add(new JavaParserTypeSolver(root));
            }
        }
        ParserConfiguration configuration = baseConfiguration();
        configuration.setSymbolResolver(new JavaSymbolSolver(typeSolver));
        return new JavaParser(configuration);
    }

    private static ParserConfiguration baseConfiguration() {
        ParserConfiguration configuration = new ParserConfiguration();
        configuration.setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);
        return configuration;
    }
}
