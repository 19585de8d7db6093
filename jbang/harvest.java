///usr/bin/env jbang "$0" "$@" ; exit $?
//JAVA 17
//DEPS org.springaicommunity:image-harvester-cli:1.0.0-SNAPSHOT

import org.springaicommunity.harvester.cli.ImageHarvesterCli;

public class harvest {
    public static void main(String[] args) throws Exception {
        ImageHarvesterCli.main(args);
    }
}
