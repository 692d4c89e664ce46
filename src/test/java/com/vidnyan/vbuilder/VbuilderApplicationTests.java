package com.vidnyan.vbuilder;

import com.vidnyan.vbuilder.application.port.out.ModuleSourceParser;
import com.vidnyan.vbuilder.application.service.DesignSession;
import com.vidnyan.vbuilder.application.service.DesignSessionFactory;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class VbuilderApplicationTests {

    @Autowired
    private DesignSessionFactory sessionFactory;

    @Autowired
    private ModuleSourceParser moduleSourceParser;

    @Autowired
    private VbuilderProperties properties;

    @Test
    void contextLoads_ShouldWireSessionsFromProperties() {
        DesignSession first = sessionFactory.newSession();
        DesignSession second = sessionFactory.newSession();

        assertEquals("top", properties.getDefaultTopName());
        assertTrue(properties.isDeriveTopNameFromFile());
        assertEquals("top", first.topModuleName());
        assertNotSame(first, second);

        first.setTopModuleName("other");
        assertEquals("top", second.topModuleName());
        assertNotNull(moduleSourceParser.parse("module m(input a); endmodule", "m.v"));
    }
}
