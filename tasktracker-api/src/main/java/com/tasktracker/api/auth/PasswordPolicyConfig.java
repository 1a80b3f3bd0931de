package com.tasktracker.api.auth;

import com.tasktracker.domain.user.PasswordPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Set;
import java.util.zip.GZIPInputStream;

@Configuration
public class PasswordPolicyConfig {

  private static final Logger log = LoggerFactory.getLogger(PasswordPolicyConfig.class);

  @Bean
  public PasswordPolicy passwordPolicy(PasswordPolicyProperties props, ResourceLoader resources) {
    Resource list = resources.getResource(props.commonPasswords());
    Set<String> common;
    try (InputStream in = open(list)) {
      common = PasswordPolicy.readCommonPasswords(in);
    } catch (IOException e) {
      throw new IllegalStateException("Cannot read common password list: " + props.commonPasswords(), e);
    }
    log.info("Password policy: minLength={} maxSimilarity={} commonPasswords={}",
        props.minLength(), props.maxSimilarity(), common.size());
    return new PasswordPolicy(props.minLength(), props.maxSimilarity(), common);
  }

  // Lists ending in .gz are read compressed, the same format Django ships its list in.
  static InputStream open(Resource list) throws IOException {
    InputStream in = list.getInputStream();
    String name = list.getFilename();
    if (name != null && name.endsWith(".gz")) {
      try {
        return new GZIPInputStream(in);
      } catch (IOException e) {
        in.close();
        throw e;
      }
    }
    return in;
  }
}
