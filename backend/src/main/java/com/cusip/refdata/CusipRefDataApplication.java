package com.cusip.refdata;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CusipRefDataApplication {

  public static void main(String[] args) {
    SpringApplication.run(CusipRefDataApplication.class, args);
  }
}
