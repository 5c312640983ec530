package io.github.yok.flexetl;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.mockConstruction;
import static org.mockito.Mockito.mockStatic;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import io.github.yok.flexetl.config.PipelineConfig;
import io.github.yok.flexetl.core.EtlOutcome;
import io.github.yok.flexetl.core.EtlRequest;
import io.github.yok.flexetl.core.EtlService;
import io.github.yok.flexetl.source.SourceKind;
import io.github.yok.flexetl.transform.StageId;
import io.github.yok.flexetl.util.ErrorHandler;
import java.util.EnumSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.MockedConstruction;
import org.mockito.MockedStatic;
import org.springframework.boot.SpringApplication;

/**
 * Unit tests for {@link Main}.
 */
class MainTest {

    private EtlService etlService;
    private PipelineConfig pipelineConfig;
    private Main main;

    @BeforeEach
    void setup() {
        etlService = mock(EtlService.class);
        pipelineConfig = new PipelineConfig();
        main = new Main(etlService, pipelineConfig);
        when(etlService.execute(any())).thenReturn(EtlOutcome.success("sales", 2, null));
    }

    @Test
    void main_正常ケース_SpringApplicationが起動されること() {
        try (MockedConstruction<SpringApplication> mocked =
                mockConstruction(SpringApplication.class, (mock, ctx) -> {
                    when(mock.run(any(String[].class))).thenReturn(null);
                })) {

            Main.main(new String[] {"-i", "data.csv", "-t", "sales"});

            SpringApplication app = mocked.constructed().get(0);
            verify(app).setAddCommandLineProperties(false);
            verify(app).run(eq("-i"), eq("data.csv"), eq("-t"), eq("sales"));
        }
    }

    @Test
    void run_正常ケース_全オプションを指定する_要求に反映されること() {
        main.run("--source", "api", "--input", "http://localhost/rows", "--table", "sales",
                "--stages", "derive-features,normalize-columns", "--target", "warehouse",
                "--preview", "3");

        ArgumentCaptor<EtlRequest> captor = ArgumentCaptor.forClass(EtlRequest.class);
        verify(etlService).execute(captor.capture());
        EtlRequest request = captor.getValue();
        assertEquals(SourceKind.API, request.getSource().getKind());
        assertEquals("http://localhost/rows", request.getSource().getLocation());
        assertEquals("sales", request.getTableName());
        assertEquals("warehouse", request.getConnectionId());
        assertEquals(EnumSet.of(StageId.NORMALIZE_COLUMNS, StageId.DERIVE_FEATURES),
                request.getStages());
        assertEquals(3, pipelineConfig.getPreviewRows());
    }

    @Test
    void run_正常ケース_短縮オプションで種別と段階を省略する_入力から種別が判定されること() {
        main.run("-i", "rows.json", "-t", "t1");

        ArgumentCaptor<EtlRequest> captor = ArgumentCaptor.forClass(EtlRequest.class);
        verify(etlService).execute(captor.capture());
        assertEquals(SourceKind.JSON, captor.getValue().getSource().getKind());
        assertNull(captor.getValue().getStages());
        assertNull(captor.getValue().getConnectionId());
    }

    @Test
    void run_異常ケース_入力未指定_ErrorHandlerが呼ばれ実行されないこと() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("-t", "sales");

            mocked.verify(
                    () -> ErrorHandler.errorAndExit("Input is required (--input <path|url>)."));
        }
        verify(etlService, never()).execute(any());
    }

    @Test
    void run_異常ケース_テーブル未指定_ErrorHandlerが呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("-i", "data.csv");

            mocked.verify(() -> ErrorHandler
                    .errorAndExit("Target table is required (--table <name>)."));
        }
        verify(etlService, never()).execute(any());
    }

    @Test
    void run_異常ケース_未知のステージ_ErrorHandlerが例外付きで呼ばれること() {
        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("-i", "data.csv", "-t", "sales", "-p", "shuffle");

            mocked.verify(() -> ErrorHandler.errorAndExit(startsWith("Invalid argument: "),
                    any(IllegalArgumentException.class)));
        }
        verify(etlService, never()).execute(any());
    }

    @Test
    void run_異常ケース_ETLが失敗する_失敗理由がErrorHandlerに渡されること() {
        when(etlService.execute(any()))
                .thenReturn(EtlOutcome.failure("No data extracted from data.csv"));

        try (MockedStatic<ErrorHandler> mocked = mockStatic(ErrorHandler.class)) {
            main.run("-i", "data.csv", "-t", "sales", "--unknown");

            mocked.verify(
                    () -> ErrorHandler.errorAndExit("ETL failed: No data extracted from data.csv"));
            mocked.verify(() -> ErrorHandler.errorAndExit(anyString(), any()), never());
        }
    }
}
