package com.cecil.assembler;

import com.cecil.assembler.model.MixedTimePolicy;
import com.cecil.assembler.service.RasterDatasetAssembler;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "aws.region=us-east-1",
        "assembler.mixed-time-policy=REJECT"
})
class RasterAssemblerApplicationTests {

    @Autowired
    private RasterDatasetAssembler assembler;

    @Test
    void contextLoads() {
        assertThat(assembler.getDefaultOptions().getMixedTimePolicy()).isEqualTo(MixedTimePolicy.REJECT);
        assertThat(assembler.getDefaultOptions().getMaxAttempts()).isEqualTo(5);
    }

}
