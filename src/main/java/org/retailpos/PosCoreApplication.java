package org.retailpos;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
@MapperScan("org.retailpos.mapper")
public class PosCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(PosCoreApplication.class, args);
    }
}
