package ch.bergturbenthal.cura.processor.media.properties;

import java.io.File;
import lombok.Value;
import org.springframework.boot.context.properties.ConstructorBinding;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConstructorBinding
@ConfigurationProperties("cura.job")
@Value
public class JobProperties {
  File root;
}
