package com.vigil.healthmonitor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.mongodb.MongoClientSettings;
import com.vigil.healthmonitor.config.VigilProperties.BackupKind;
import com.vigil.healthmonitor.config.VigilProperties.BackupTargetEntry;
import com.vigil.monitoring.backup.BackupTarget;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("MonitoringConfig")
class MonitoringConfigTest {

    @Nested
    @DisplayName("backup targets")
    class BackupTargets {

        @Test
        @DisplayName("SQL targets match dumps by default")
        void sqlDumps() {
            BackupTarget target =
                    MonitoringConfig.toTarget(new BackupTargetEntry("postgres", BackupKind.SQL, null), null);

            assertThat(target.filePattern().matcher("postgres_2026-03-05.sql.gz").find()).isTrue();
            assertThat(target.filePattern().matcher("mongo_2026-03-05.archive").find()).isFalse();
            assertThat(target.cloudManaged()).isFalse();
        }

        @Test
        @DisplayName("SQL targets honour a custom pattern")
        void sqlCustomPattern() {
            BackupTarget target =
                    MonitoringConfig.toTarget(new BackupTargetEntry("mysql", BackupKind.SQL, "^mysql-.*\\.dump$"), null);

            assertThat(target.filePattern().matcher("mysql-nightly.dump").find()).isTrue();
        }

        @Test
        @DisplayName("document store backups are cloud-managed on Atlas")
        void atlasIsCloudManaged() {
            var entry = new BackupTargetEntry("mongodb", BackupKind.MONGO, null);

            assertThat(MonitoringConfig.toTarget(entry, "mongodb+srv://cluster0.example.mongodb.net/app").cloudManaged())
                    .isTrue();
            assertThat(MonitoringConfig.toTarget(entry, "mongodb://localhost:27017/app").cloudManaged()).isFalse();
        }

        @Test
        @DisplayName("pattern targets require a pattern")
        void patternRequired() {
            assertThatThrownBy(
                            () -> MonitoringConfig.toTarget(new BackupTargetEntry("uploads", BackupKind.PATTERN, " "), null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessage("pattern must not be null for backup target uploads");
        }

        @Test
        @DisplayName("pattern targets use the given regex")
        void patternTarget() {
            BackupTarget target =
                    MonitoringConfig.toTarget(new BackupTargetEntry("uploads", BackupKind.PATTERN, "^uploads-.*\\.tar$"), null);

            assertThat(target.type()).isEqualTo("uploads");
            assertThat(target.filePattern().matcher("uploads-0305.tar").find()).isTrue();
        }
    }

    @Nested
    @DisplayName("mongoTimeouts")
    class MongoTimeouts {

        @Test
        @DisplayName("bounds server selection and connects by the ping timeout")
        void appliesPingTimeout() {
            MongoClientSettings.Builder builder = MongoClientSettings.builder();

            MonitoringConfig.mongoTimeouts(Duration.ofSeconds(5)).customize(builder);
            MongoClientSettings settings = builder.build();

            assertThat(settings.getClusterSettings().getServerSelectionTimeout(TimeUnit.MILLISECONDS)).isEqualTo(5000);
            assertThat(settings.getSocketSettings().getConnectTimeout(TimeUnit.MILLISECONDS)).isEqualTo(5000);
        }
    }
}
