package com.upgradeguard.upgradecheck;

import com.upgradeguard.upgradecheck.config.UpgradeCheckProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Upgrade check: decides whether the live database may be handed to a target release.
 *
 * <p>Runs once and exits. The process exit status is the result:
 *
 * <ul>
 *   <li>{@code 0}: the engine version gate passed and every applied migration is accounted for
 *   <li>{@code 1}: engine version mismatch, unsupported engine, or applied migrations the target
 *       does not know about (a downgrade or a branch switch rather than an upgrade)
 * </ul>
 *
 * <p>Typical invocation from a deploy script:
 *
 * <pre>
 * java -jar upgrade-check.jar \
 *   --spring.datasource.url=jdbc:postgresql://localhost:5432/zulip \
 *   --upgradeguard.check.target-manifest=file:/home/zulip/deployments/next/migrations.json \
 *   --upgradeguard.check.deployed-version-file=/home/zulip/deployments/current/version.txt
 * </pre>
 */
@SpringBootApplication
@EnableConfigurationProperties(UpgradeCheckProperties.class)
public class UpgradeCheckApplication {

    public static void main(String[] args) {
        System.exit(
                SpringApplication.exit(SpringApplication.run(UpgradeCheckApplication.class, args)));
    }
}
