package com.paramkit;

import com.paramkit.cli.ParseResult;
import com.paramkit.codec.ValueCodecs;
import com.paramkit.model.ParamKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sample application declaring one parameter of most kinds.
 *
 * Try {@code --xml}, {@code --help} or {@code --ctk-save-ini demo.ini}.
 */
public class DemoApplication {
    private static final Logger log = LoggerFactory.getLogger(DemoApplication.class);

    public static void main(String[] args) {
        ParamApplication app = ParamApplication.create("The Big Test", "Does absolutely nothing.");
        declareParameters(app);

        ParseResult result = app.parseCommandLine(args);
        if (result.getRemainingCount() > 0) {
            log.info("Unhandled arguments: {}", result.getRemaining());
        }
        log.info("Bool Param = {}, Slider = {}",
                app.get("Basic Types", "Bool Param", ValueCodecs.BOOLEAN),
                app.get("Special", "Slider", ValueCodecs.DOUBLE));
        System.exit(0);
    }

    static void declareParameters(ParamApplication app) {
        app.getMetadata()
                .setCategory("Toys")
                .setVersion("1.0")
                .setContributor("Santa");

        // Basic types
        app.declare("Basic Types", "Bool Param", ParamKind.BOOLEAN).flag("Just a test", "b").value(true);

        // Enumerations
        app.declare("EnumTypes", "Double Enum", ParamKind.DOUBLE_ENUMERATION).enumeration("0.1,0.2,0.3,0.4");
        app.set("EnumTypes", "Double Enum", ValueCodecs.DOUBLE, 0.3);

        // Vectors
        app.declare("Vector Types", "Double Vec", ParamKind.DOUBLE_VECTOR).text("1,2,3,4");

        // Special
        app.declare("Special", "File", ParamKind.FILE)
                .fileExtensions("bli,bla,blbub")
                .index("Input File", 0)
                .channel(true);
        app.declare("Special", "Slider", ParamKind.DOUBLE).range(0, 1).value(0.333);
    }
}
